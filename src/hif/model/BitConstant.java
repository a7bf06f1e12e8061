package hif.model;

/** Values of a single (possibly logic) bit. */
public enum BitConstant {
  ZERO('0', false),
  ONE('1', false),
  X('X', true),
  Z('Z', true),
  DONT_CARE('-', true);

  public final char symbol;
  /** True for values only representable by logic bits. */
  public final boolean logicOnly;

  private BitConstant(char symbol, boolean logicOnly) {
    this.symbol = symbol;
    this.logicOnly = logicOnly;
  }

  public static BitConstant fromSymbol(char c) {
    for (BitConstant b : values())
      if (b.symbol == Character.toUpperCase(c))
        return b;
    throw new IllegalArgumentException("Unknown bit value '" + c + "'");
  }
}
