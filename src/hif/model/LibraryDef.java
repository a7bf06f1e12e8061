package hif.model;

import java.util.Map;

/** A package: a named collection of declarations that can be imported by Library nodes. */
public class LibraryDef extends Declaration implements Scope {
  public final NodeList<Declaration> declarations = addList("declarations", Declaration.class);
  public final NodeList<Library> libraries = addList("libraries", Library.class);

  private boolean standard = false;

  public LibraryDef() { super(); }
  public LibraryDef(String name, boolean standard) {
    this();
    setName(name);
    this.standard = standard;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.LIBRARY_DEF;
  }

  @Override
  public NodeList<Declaration> getDeclarations() {
    return declarations;
  }
  @Override
  public NodeList<Library> getLibraries() {
    return libraries;
  }

  /** True for predefined packages provided by a language semantics. */
  public boolean isStandard() { return standard; }
  public void setStandard(boolean standard) { this.standard = standard; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    super.collectAttributes(into);
    into.put("standard", standard);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("standard")) {
      standard = asBoolean(value);
      return true;
    }
    return super.setAttribute(key, value);
  }
}
