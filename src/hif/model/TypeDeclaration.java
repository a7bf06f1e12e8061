package hif.model;

/** Declaration naming a type: type definitions and generic type parameters. */
public abstract class TypeDeclaration extends Declaration {
  private static final int TYPE = 0;

  protected TypeDeclaration() { super("type"); }

  /** The defined type, or the default type of a generic type parameter (may be null). */
  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type type) { return (Type)setSlot(TYPE, type); }
}
