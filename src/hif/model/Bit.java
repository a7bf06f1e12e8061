package hif.model;

import java.util.Map;

public class Bit extends Type {
  private boolean logic = false;
  private boolean resolved = false;
  private boolean constexpr = false;

  public Bit() { super(); }
  public Bit(boolean logic, boolean resolved) {
    super();
    this.logic = logic;
    this.resolved = resolved;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BIT;
  }

  public boolean isLogic() { return logic; }
  public void setLogic(boolean logic) { this.logic = logic; }
  public boolean isResolved() { return resolved; }
  public void setResolved(boolean resolved) { this.resolved = resolved; }
  public boolean isConstexpr() { return constexpr; }
  public void setConstexpr(boolean constexpr) { this.constexpr = constexpr; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("logic", logic);
    into.put("resolved", resolved);
    into.put("constexpr", constexpr);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "logic":
      logic = asBoolean(value);
      return true;
    case "resolved":
      resolved = asBoolean(value);
      return true;
    case "constexpr":
      constexpr = asBoolean(value);
      return true;
    default:
      return false;
    }
  }
}
