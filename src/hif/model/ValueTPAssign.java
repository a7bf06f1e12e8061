package hif.model;

public class ValueTPAssign extends TPAssign {
  private static final int VALUE = 0;

  public ValueTPAssign() { super("value"); }
  public ValueTPAssign(String name, Value value) {
    this();
    setName(name);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VALUE_TP_ASSIGN;
  }

  public Value getValue() { return (Value)getSlot(VALUE); }
  public Value setValue(Value v) { return (Value)setSlot(VALUE, v); }

  @Override
  public Node getPayload() {
    return getValue();
  }

  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return ValueTP.class;
  }
}
