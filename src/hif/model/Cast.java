package hif.model;

public class Cast extends Value {
  private static final int VALUE = 0;
  private static final int TYPE = 1;

  public Cast() { super("value", "type"); }
  public Cast(Value value, Type type) {
    this();
    setValue(value);
    setType(type);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CAST;
  }

  public Value getValue() { return (Value)getSlot(VALUE); }
  public Value setValue(Value v) { return (Value)setSlot(VALUE, v); }
  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type t) { return (Type)setSlot(TYPE, t); }
}
