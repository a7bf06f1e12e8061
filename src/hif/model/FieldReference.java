package hif.model;

import java.util.Map;

/** Access to a named field of a record-typed prefix. */
public class FieldReference extends Value implements Symbol {
  private static final int PREFIX = 0;

  private String name = "";
  private Declaration declaration = null;

  public FieldReference() { super("prefix"); }
  public FieldReference(Value prefix, String name) {
    this();
    setPrefix(prefix);
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FIELD_REFERENCE;
  }

  public Value getPrefix() { return (Value)getSlot(PREFIX); }
  public Value setPrefix(Value v) { return (Value)setSlot(PREFIX, v); }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

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
    return DataDeclaration.class;
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("name", name);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("name")) {
      setName(String.valueOf(value));
      return true;
    }
    return false;
  }
}
