package hif.model;

/** Literal value. The optional syntactic type slot records the type the literal was written with. */
public abstract class ConstValue extends Value {
  private static final int TYPE = 0;

  protected ConstValue() { super("type"); }

  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type type) { return (Type)setSlot(TYPE, type); }
}
