package hif.model;

/** A process or subprogram body: local declarations and a sequence of actions. */
public class StateTable extends Declaration implements Scope {
  public final NodeList<Declaration> declarations = addList("declarations", Declaration.class);
  public final NodeList<Action> actions = addList("actions", Action.class);

  public StateTable() { super(); }
  public StateTable(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.STATE_TABLE;
  }

  @Override
  public NodeList<Declaration> getDeclarations() {
    return declarations;
  }
}
