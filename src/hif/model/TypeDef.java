package hif.model;

import java.util.Map;

/**
 * Named type definition. An opaque definition introduces a new type (e.g. an enumeration);
 * a non-opaque one is an alias of its type. External definitions stand for types declared outside the design.
 */
public class TypeDef extends TypeDeclaration implements Scope {
  public final NodeList<Declaration> templateParameters = addList("templateParameters", Declaration.class);

  private boolean opaque = false;
  private boolean external = false;

  public TypeDef() { super(); }
  public TypeDef(String name, Type type, boolean opaque) {
    this();
    setName(name);
    setType(type);
    this.opaque = opaque;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TYPE_DEF;
  }

  @Override
  public NodeList<Declaration> getTemplateParameters() {
    return templateParameters;
  }

  public boolean isOpaque() { return opaque; }
  public void setOpaque(boolean opaque) { this.opaque = opaque; }
  public boolean isExternal() { return external; }
  public void setExternal(boolean external) { this.external = external; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    super.collectAttributes(into);
    into.put("opaque", opaque);
    into.put("external", external);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    switch (key) {
    case "opaque":
      opaque = asBoolean(value);
      return true;
    case "external":
      external = asBoolean(value);
      return true;
    default:
      return super.setAttribute(key, value);
    }
  }
}
