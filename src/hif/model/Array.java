package hif.model;

import java.util.Map;

public class Array extends Type {
  private static final int TYPE = 0;
  private static final int SPAN = 1;

  private boolean signed = false;

  public Array() { super("type", "span"); }
  public Array(Type elementType, Range span) {
    this();
    setType(elementType);
    setSpan(span);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ARRAY;
  }

  /** The element type. */
  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type type) { return (Type)setSlot(TYPE, type); }

  public Range getSpan() { return (Range)getSlot(SPAN); }
  public Range setSpan(Range span) { return (Range)setSlot(SPAN, span); }

  public boolean isSigned() { return signed; }
  public void setSigned(boolean signed) { this.signed = signed; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("signed", signed);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("signed")) {
      signed = asBoolean(value);
      return true;
    }
    return false;
  }
}
