package hif.model;

public class Return extends Action {
  private static final int VALUE = 0;

  public Return() { super("value"); }
  public Return(Value value) {
    this();
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.RETURN;
  }

  public Value getValue() { return (Value)getSlot(VALUE); }
  public Value setValue(Value v) { return (Value)setSlot(VALUE, v); }
}
