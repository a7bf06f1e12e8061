package hif.model;

public class Field extends DataDeclaration {
  public Field() { super(); }
  public Field(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FIELD;
  }
}
