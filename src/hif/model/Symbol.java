package hif.model;

/**
 * Capability of a node that names a Declaration instead of owning it.
 * The resolved declaration is cached on the symbol as a non-owning reference.
 * The cache is never refreshed implicitly: it is populated on first resolution and cleared by an explicit reset.
 */
public interface Symbol extends NamedNode {
  /** Returns the cached declaration, or null if not resolved yet. */
  Declaration getDeclaration();
  /** Sets (or clears, with null) the cached declaration. */
  void setDeclaration(Declaration declaration);
  /** The declaration variant this symbol can be bound to. */
  Class<? extends Declaration> getDeclarationType();
}
