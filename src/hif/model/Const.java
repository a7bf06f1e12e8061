package hif.model;

public class Const extends DataDeclaration {
  public Const() { super(); }
  public Const(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CONST;
  }
}
