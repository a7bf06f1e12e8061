package hif.model;

import java.util.Map;

/** Reference to a data declaration by name. */
public class Identifier extends Value implements Symbol {
  private String name = "";
  private Declaration declaration = null;

  public Identifier() { super(); }
  public Identifier(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IDENTIFIER;
  }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  @Override
  public Declaration getDeclaration() {
    return declaration;
  }
  @Override
  public void setDeclaration(Declaration declaration) {
    this.declaration = declaration;
  }
  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return DataDeclaration.class;
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
