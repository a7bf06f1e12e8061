package hif.model;

public class Signal extends DataDeclaration {
  public Signal() { super(); }
  public Signal(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.SIGNAL;
  }
}
