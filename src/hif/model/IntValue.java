package hif.model;

import java.util.Map;

public class IntValue extends ConstValue {
  private long value = 0;

  public IntValue() { super(); }
  public IntValue(long value) {
    this();
    this.value = value;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INT_VALUE;
  }

  public long getValue() { return value; }
  public void setValue(long value) { this.value = value; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("value", value);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("value")) {
      this.value = asLong(value);
      return true;
    }
    return false;
  }
}
