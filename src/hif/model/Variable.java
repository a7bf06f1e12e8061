package hif.model;

public class Variable extends DataDeclaration {
  public Variable() { super(); }
  public Variable(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VARIABLE;
  }
}
