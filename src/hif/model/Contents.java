package hif.model;

/** Implementation of a view: local declarations, imported libraries, processes and instances. */
public class Contents extends Declaration implements Scope {
  public final NodeList<Declaration> declarations = addList("declarations", Declaration.class);
  public final NodeList<Library> libraries = addList("libraries", Library.class);
  public final NodeList<StateTable> stateTables = addList("stateTables", StateTable.class);
  public final NodeList<Instance> instances = addList("instances", Instance.class);

  public Contents() { super(); }

  @Override
  public NodeKind getKind() {
    return NodeKind.CONTENTS;
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
