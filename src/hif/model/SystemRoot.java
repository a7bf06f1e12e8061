package hif.model;

/**
 * The distinguished root of a design tree.
 * A subtree whose topmost ancestor is not a SystemRoot is orphaned.
 */
public class SystemRoot extends Declaration implements Scope {
  public final NodeList<DesignUnit> designUnits = addList("designUnits", DesignUnit.class);
  public final NodeList<LibraryDef> libraryDefs = addList("libraryDefs", LibraryDef.class);
  public final NodeList<Declaration> declarations = addList("declarations", Declaration.class);
  public final NodeList<Library> libraries = addList("libraries", Library.class);

  public SystemRoot() { super(); }
  public SystemRoot(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.SYSTEM;
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
