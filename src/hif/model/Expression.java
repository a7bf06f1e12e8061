package hif.model;

import java.util.Map;

/** Unary or binary operation. The second operand is null for unary operators. */
public class Expression extends Value {
  private static final int OP1 = 0;
  private static final int OP2 = 1;

  private Operator operator = Operator.PLUS;

  public Expression() { super("value1", "value2"); }
  public Expression(Operator operator, Value op1, Value op2) {
    this();
    this.operator = operator;
    setValue1(op1);
    setValue2(op2);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.EXPRESSION;
  }

  public Operator getOperator() { return operator; }
  public void setOperator(Operator operator) { this.operator = operator; }

  public Value getValue1() { return (Value)getSlot(OP1); }
  public Value setValue1(Value v) { return (Value)setSlot(OP1, v); }
  public Value getValue2() { return (Value)getSlot(OP2); }
  public Value setValue2(Value v) { return (Value)setSlot(OP2, v); }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("operator", operator.serialName);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("operator")) {
      operator = Operator.fromSerialName(String.valueOf(value));
      return true;
    }
    return false;
  }
}
