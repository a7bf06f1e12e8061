package hif.model;

public class DesignUnit extends Declaration {
  public final NodeList<View> views = addList("views", View.class);

  public DesignUnit() { super(); }
  public DesignUnit(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DESIGN_UNIT;
  }
}
