package hif.model;

import java.util.Map;

/**
 * Reference to a design view, by design unit name and view name.
 * Used as the referenced type of instances.
 */
public class ViewReference extends Type implements Symbol {
  public final NodeList<TPAssign> templateParameterAssigns = addList("templateParameterAssigns", TPAssign.class);

  private String name = "";
  private String designUnit = "";
  private Declaration declaration = null;

  public ViewReference() { super(); }
  public ViewReference(String designUnit, String name) {
    this();
    setDesignUnit(designUnit);
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VIEW_REFERENCE;
  }

  /** The view name. */
  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  public String getDesignUnit() { return designUnit; }
  public void setDesignUnit(String designUnit) { this.designUnit = (designUnit == null ? "" : designUnit); }

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
    return View.class;
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("name", name);
    into.put("designUnit", designUnit);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "name":
      setName(String.valueOf(value));
      return true;
    case "designUnit":
      setDesignUnit(String.valueOf(value));
      return true;
    default:
      return false;
    }
  }
}
