package hif.model;

import java.util.Map;

/** Vector of bits with arithmetic interpretation given by the signed flag. */
public class Bitvector extends Type {
  private static final int SPAN = 0;

  private boolean signed = false;
  private boolean logic = false;
  private boolean resolved = false;
  private boolean constexpr = false;

  public Bitvector() { super("span"); }
  public Bitvector(Range span, boolean signed, boolean logic, boolean resolved) {
    this();
    setSpan(span);
    this.signed = signed;
    this.logic = logic;
    this.resolved = resolved;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BITVECTOR;
  }

  public Range getSpan() { return (Range)getSlot(SPAN); }
  public Range setSpan(Range span) { return (Range)setSlot(SPAN, span); }

  public boolean isSigned() { return signed; }
  public void setSigned(boolean signed) { this.signed = signed; }
  public boolean isLogic() { return logic; }
  public void setLogic(boolean logic) { this.logic = logic; }
  public boolean isResolved() { return resolved; }
  public void setResolved(boolean resolved) { this.resolved = resolved; }
  public boolean isConstexpr() { return constexpr; }
  public void setConstexpr(boolean constexpr) { this.constexpr = constexpr; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("signed", signed);
    into.put("logic", logic);
    into.put("resolved", resolved);
    into.put("constexpr", constexpr);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "signed":
      signed = asBoolean(value);
      return true;
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
