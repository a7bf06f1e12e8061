package hif.model;

/**
 * Declaration of a typed datum: constants, variables, signals, ports, parameters, value generics, fields.
 * The value slot holds the initial or default value; the range slot an optional range constraint.
 */
public abstract class DataDeclaration extends Declaration {
  private static final int TYPE = 0;
  private static final int VALUE = 1;
  private static final int RANGE = 2;

  protected DataDeclaration() { super("type", "value", "range"); }

  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type type) { return (Type)setSlot(TYPE, type); }

  public Value getValue() { return (Value)getSlot(VALUE); }
  public Value setValue(Value value) { return (Value)setSlot(VALUE, value); }

  public Range getRange() { return (Range)getSlot(RANGE); }
  public Range setRange(Range range) { return (Range)setSlot(RANGE, range); }
}
