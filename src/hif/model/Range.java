package hif.model;

import java.util.Map;

/** A span with left and right bounds and a direction. */
public class Range extends Node {
  private static final int LEFT = 0;
  private static final int RIGHT = 1;

  private RangeDirection direction = RangeDirection.DOWNTO;

  public Range() { super("left", "right"); }
  public Range(Value left, Value right, RangeDirection direction) {
    this();
    setLeftBound(left);
    setRightBound(right);
    this.direction = direction;
  }
  /** Convenience for constant spans such as {@code 7 downto 0}. */
  public Range(long left, long right) {
    this(new IntValue(left), new IntValue(right), left >= right ? RangeDirection.DOWNTO : RangeDirection.UPTO);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.RANGE;
  }

  public Value getLeftBound() { return (Value)getSlot(LEFT); }
  public Value setLeftBound(Value v) { return (Value)setSlot(LEFT, v); }
  public Value getRightBound() { return (Value)getSlot(RIGHT); }
  public Value setRightBound(Value v) { return (Value)setSlot(RIGHT, v); }

  public RangeDirection getDirection() { return direction; }
  public void setDirection(RangeDirection direction) { this.direction = direction; }

  /** Bound nearest to the most significant side, independently of direction. */
  public Value getBound(boolean left, RangeDirection dir) {
    if (dir != direction)
      return left ? getRightBound() : getLeftBound();
    return left ? getLeftBound() : getRightBound();
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("direction", direction.serialName);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("direction")) {
      direction = RangeDirection.fromSerialName(String.valueOf(value));
      return true;
    }
    return false;
  }
}
