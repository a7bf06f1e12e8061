package hif.model;

import java.util.Map;

/**
 * Import of a library definition into a scope.
 * A system library may stand for an opaque external header that has no declaration.
 */
public class Library extends Node implements Symbol {
  private String name = "";
  private boolean system = false;
  private Declaration declaration = null;

  public Library() { super(); }
  public Library(String name, boolean system) {
    this();
    setName(name);
    this.system = system;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.LIBRARY;
  }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  public boolean isSystem() { return system; }
  public void setSystem(boolean system) { this.system = system; }

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
    return LibraryDef.class;
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("name", name);
    into.put("system", system);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "name":
      setName(String.valueOf(value));
      return true;
    case "system":
      system = asBoolean(value);
      return true;
    default:
      return false;
    }
  }
}
