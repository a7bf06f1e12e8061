package hif.model;

import java.util.Map;

public class Bool extends Type {
  private boolean constexpr = false;

  public Bool() { super(); }

  @Override
  public NodeKind getKind() {
    return NodeKind.BOOL;
  }

  public boolean isConstexpr() { return constexpr; }
  public void setConstexpr(boolean constexpr) { this.constexpr = constexpr; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("constexpr", constexpr);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("constexpr")) {
      constexpr = asBoolean(value);
      return true;
    }
    return false;
  }
}
