package hif.model;

import java.util.Map;

/**
 * A named entity introduced in some scope.
 * Declarations are owned by their enclosing scope.
 */
public abstract class Declaration extends Node implements NamedNode {
  private String name = "";

  protected Declaration(String... slotNames) { super(slotNames); }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("name", name);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("name")) {
      setName(String.valueOf(value));
      return true;
    }
    return false;
  }
}
