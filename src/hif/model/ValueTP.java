package hif.model;

public class ValueTP extends DataDeclaration {
  public ValueTP() { super(); }
  public ValueTP(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VALUE_TP;
  }
}
