package hif.model;

/** Indexed access into an array or bit vector. */
public class Member extends Value {
  private static final int PREFIX = 0;
  private static final int INDEX = 1;

  public Member() { super("prefix", "index"); }
  public Member(Value prefix, Value index) {
    this();
    setPrefix(prefix);
    setIndex(index);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MEMBER;
  }

  public Value getPrefix() { return (Value)getSlot(PREFIX); }
  public Value setPrefix(Value v) { return (Value)setSlot(PREFIX, v); }
  public Value getIndex() { return (Value)getSlot(INDEX); }
  public Value setIndex(Value v) { return (Value)setSlot(INDEX, v); }
}
