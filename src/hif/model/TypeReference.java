package hif.model;

import java.util.Map;

/** Reference to a named type: a type definition or a generic type parameter. */
public class TypeReference extends Type implements Symbol {
  public final NodeList<TPAssign> templateParameterAssigns = addList("templateParameterAssigns", TPAssign.class);

  private String name = "";
  private Declaration declaration = null;

  public TypeReference() { super(); }
  public TypeReference(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TYPE_REFERENCE;
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
    return TypeDeclaration.class;
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
