package hif.model;

public class TypeTPAssign extends TPAssign {
  private static final int TYPE = 0;

  public TypeTPAssign() { super("type"); }
  public TypeTPAssign(String name, Type type) {
    this();
    setName(name);
    setType(type);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TYPE_TP_ASSIGN;
  }

  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type t) { return (Type)setSlot(TYPE, t); }

  @Override
  public Node getPayload() {
    return getType();
  }

  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return TypeTP.class;
  }
}
