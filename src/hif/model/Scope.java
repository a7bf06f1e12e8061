package hif.model;

/**
 * A node owning declaration, library import or generic parameter lists.
 * Absent capabilities are reported as null.
 */
public interface Scope {
  default NodeList<Declaration> getDeclarations() { return null; }
  default NodeList<Library> getLibraries() { return null; }
  default NodeList<Declaration> getTemplateParameters() { return null; }
}
