package hif.model;

/** The interface of a view: its ports. */
public class Entity extends Declaration {
  public final NodeList<Port> ports = addList("ports", Port.class);

  public Entity() { super(); }
  public Entity(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ENTITY;
  }
}
