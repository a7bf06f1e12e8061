package hif.model;

/**
 * Operators of HIF expressions.
 * CONV is not written in source code: it asks a semantics whether a value of one type is assignable to another.
 */
public enum Operator {
  PLUS("+", Category.ARITHMETIC, 2),
  MINUS("-", Category.ARITHMETIC, 2),
  MULT("*", Category.ARITHMETIC, 2),
  DIV("/", Category.ARITHMETIC, 2),
  MOD("%", Category.ARITHMETIC, 2),
  NEG("neg", Category.ARITHMETIC, 1),
  EQ("==", Category.RELATIONAL, 2),
  NEQ("!=", Category.RELATIONAL, 2),
  LT("<", Category.RELATIONAL, 2),
  LE("<=", Category.RELATIONAL, 2),
  GT(">", Category.RELATIONAL, 2),
  GE(">=", Category.RELATIONAL, 2),
  AND("&&", Category.LOGIC, 2),
  OR("||", Category.LOGIC, 2),
  NOT("!", Category.LOGIC, 1),
  BAND("&", Category.BITWISE, 2),
  BOR("|", Category.BITWISE, 2),
  BXOR("^", Category.BITWISE, 2),
  BNOT("~", Category.BITWISE, 1),
  SLL("<<", Category.SHIFT, 2),
  SRL(">>", Category.SHIFT, 2),
  CONCAT("concat", Category.CONCAT, 2),
  CONV("conv", Category.CONVERSION, 2);

  public enum Category { ARITHMETIC, RELATIONAL, LOGIC, BITWISE, SHIFT, CONCAT, CONVERSION }

  public final String serialName;
  public final Category category;
  public final int arity;

  private Operator(String serialName, Category category, int arity) {
    this.serialName = serialName;
    this.category = category;
    this.arity = arity;
  }

  public boolean isUnary() { return arity == 1; }

  public static Operator fromSerialName(String name) {
    for (Operator op : values())
      if (op.serialName.equals(name) || op.name().equals(name))
        return op;
    throw new IllegalArgumentException("Unknown operator '" + name + "'");
  }
}
