package hif.model;

/** Assignment statement. */
public class Assign extends Action {
  private static final int LHS = 0;
  private static final int RHS = 1;

  public Assign() { super("leftHandSide", "rightHandSide"); }
  public Assign(Value lhs, Value rhs) {
    this();
    setLeftHandSide(lhs);
    setRightHandSide(rhs);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ASSIGN;
  }

  public Value getLeftHandSide() { return (Value)getSlot(LHS); }
  public Value setLeftHandSide(Value v) { return (Value)setSlot(LHS, v); }
  public Value getRightHandSide() { return (Value)getSlot(RHS); }
  public Value setRightHandSide(Value v) { return (Value)setSlot(RHS, v); }
}
