package hif.model;

import java.util.Map;

/**
 * An actual argument: an optional name plus a value or type, matched against a formal declaration.
 * An empty name means the argument is positional.
 */
public abstract class ReferencedAssign extends Node implements Symbol {
  private String name = "";
  private Declaration declaration = null;

  protected ReferencedAssign(String... slotNames) { super(slotNames); }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  public boolean isNamed() { return !name.isEmpty(); }

  @Override
  public Declaration getDeclaration() {
    return declaration;
  }
  @Override
  public void setDeclaration(Declaration declaration) {
    this.declaration = declaration;
  }

  /** The argument payload: a Value for value arguments, a Type for generic type arguments. */
  public abstract Node getPayload();

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
