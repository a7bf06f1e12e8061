package hif.semantics;

/** How a standard symbol of one semantics is carried over to another. */
public enum MapAction {
  /** No equivalent exists in the target semantics. */
  UNSUPPORTED,
  /** The symbol is removed by a simplification step instead of being mapped. */
  SIMPLIFIED,
  /** Replace the symbol and keep its declaration. */
  MAP_KEEP,
  /** Replace the symbol and drop its original declaration. */
  MAP_DELETE,
  /** The declaration is not a standard one. */
  UNKNOWN
}
