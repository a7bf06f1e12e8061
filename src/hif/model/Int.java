package hif.model;

import java.util.Map;

/** Integer type, optionally bounded by a span. */
public class Int extends Type {
  private static final int SPAN = 0;

  private boolean signed = true;
  private boolean constexpr = false;

  public Int() { super("span"); }
  public Int(Range span, boolean signed) {
    this();
    setSpan(span);
    this.signed = signed;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.INT;
  }

  public Range getSpan() { return (Range)getSlot(SPAN); }
  public Range setSpan(Range span) { return (Range)setSlot(SPAN, span); }

  public boolean isSigned() { return signed; }
  public void setSigned(boolean signed) { this.signed = signed; }
  public boolean isConstexpr() { return constexpr; }
  public void setConstexpr(boolean constexpr) { this.constexpr = constexpr; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("signed", signed);
    into.put("constexpr", constexpr);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "signed":
      signed = asBoolean(value);
      return true;
    case "constexpr":
      constexpr = asBoolean(value);
      return true;
    default:
      return false;
    }
  }
}
