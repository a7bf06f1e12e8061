package hif.model;

import java.util.Map;

public class BoolValue extends ConstValue {
  private boolean value = false;

  public BoolValue() { super(); }
  public BoolValue(boolean value) {
    this();
    this.value = value;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BOOL_VALUE;
  }

  public boolean getValue() { return value; }
  public void setValue(boolean value) { this.value = value; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("value", value);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("value")) {
      this.value = asBoolean(value);
      return true;
    }
    return false;
  }
}
