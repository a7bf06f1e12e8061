package hif.model;

public class Procedure extends SubProgram {
  private static final int STATE_TABLE = 0;

  public Procedure() { super("stateTable"); }
  public Procedure(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PROCEDURE;
  }

  @Override
  public StateTable getStateTable() {
    return (StateTable)getSlot(STATE_TABLE);
  }
  @Override
  public StateTable setStateTable(StateTable body) {
    return (StateTable)setSlot(STATE_TABLE, body);
  }
}
