package hif.model;

import java.util.Map;

public class BitValue extends ConstValue {
  private BitConstant value = BitConstant.ZERO;

  public BitValue() { super(); }
  public BitValue(BitConstant value) {
    this();
    this.value = value;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BIT_VALUE;
  }

  public BitConstant getValue() { return value; }
  public void setValue(BitConstant value) { this.value = value; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("value", String.valueOf(value.symbol));
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("value")) {
      String s = String.valueOf(value);
      if (s.length() != 1)
        throw new IllegalArgumentException("Bit value must be a single character, got '" + s + "'");
      this.value = BitConstant.fromSymbol(s.charAt(0));
      return true;
    }
    return false;
  }
}
