package hif.model;

/** A design view: interface (entity), generics and implementation (contents). */
public class View extends Declaration implements Scope {
  private static final int ENTITY = 0;
  private static final int CONTENTS = 1;

  public final NodeList<Declaration> templateParameters = addList("templateParameters", Declaration.class);
  public final NodeList<Declaration> declarations = addList("declarations", Declaration.class);
  public final NodeList<Library> libraries = addList("libraries", Library.class);

  public View() { super("entity", "contents"); }
  public View(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VIEW;
  }

  public Entity getEntity() { return (Entity)getSlot(ENTITY); }
  public Entity setEntity(Entity e) { return (Entity)setSlot(ENTITY, e); }
  public Contents getContents() { return (Contents)getSlot(CONTENTS); }
  public Contents setContents(Contents c) { return (Contents)setSlot(CONTENTS, c); }

  @Override
  public NodeList<Declaration> getTemplateParameters() {
    return templateParameters;
  }
  @Override
  public NodeList<Declaration> getDeclarations() {
    return declarations;
  }
  @Override
  public NodeList<Library> getLibraries() {
    return libraries;
  }
}
