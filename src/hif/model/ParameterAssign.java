package hif.model;

public class ParameterAssign extends ReferencedAssign {
  private static final int VALUE = 0;

  public ParameterAssign() { super("value"); }
  public ParameterAssign(String name, Value value) {
    this();
    setName(name);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PARAMETER_ASSIGN;
  }

  public Value getValue() { return (Value)getSlot(VALUE); }
  public Value setValue(Value v) { return (Value)setSlot(VALUE, v); }

  @Override
  public Node getPayload() {
    return getValue();
  }

  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return Parameter.class;
  }
}
