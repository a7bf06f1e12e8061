package hif.model;

public class Function extends SubProgram {
  private static final int TYPE = 0;
  private static final int STATE_TABLE = 1;

  public Function() { super("type", "stateTable"); }
  public Function(String name, Type returnType) {
    this();
    setName(name);
    setType(returnType);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION;
  }

  /** The return type. */
  public Type getType() { return (Type)getSlot(TYPE); }
  public Type setType(Type t) { return (Type)setSlot(TYPE, t); }

  @Override
  public StateTable getStateTable() {
    return (StateTable)getSlot(STATE_TABLE);
  }
  @Override
  public StateTable setStateTable(StateTable body) {
    return (StateTable)setSlot(STATE_TABLE, body);
  }
}
