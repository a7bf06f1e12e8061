package hif.model;

/**
 * Instantiation of a view inside contents, with its port bindings.
 * As a symbol, an instance is bound to the entity of the referenced view.
 */
public class Instance extends Declaration implements Symbol {
  private static final int REFERENCED_TYPE = 0;

  public final NodeList<PortAssign> portAssigns = addList("portAssigns", PortAssign.class);

  private Declaration declaration = null;

  public Instance() { super("referencedType"); }
  public Instance(String name, ViewReference referencedType) {
    this();
    setName(name);
    setReferencedType(referencedType);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INSTANCE;
  }

  public Type getReferencedType() { return (Type)getSlot(REFERENCED_TYPE); }
  public Type setReferencedType(Type t) { return (Type)setSlot(REFERENCED_TYPE, t); }

  @Override
  public Declaration getDeclaration() {
    return declaration;
  }
  @Override
  public void setDeclaration(Declaration declaration) {
    this.declaration = declaration;
  }
  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return Entity.class;
  }
}
