package hif.model;

public class EnumValue extends DataDeclaration {
  public EnumValue() { super(); }
  public EnumValue(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ENUM_VALUE;
  }
}
