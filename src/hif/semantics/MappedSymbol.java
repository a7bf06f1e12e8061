package hif.semantics;

/**
 * Target of a standard symbol mapping.
 * @param action what to do with the symbol
 * @param libraryName the target standard library, or null when the action has no target
 * @param symbolName the target symbol name, or null when the action has no target
 */
public record MappedSymbol(MapAction action, String libraryName, String symbolName) {
  public static MappedSymbol of(MapAction action) {
    return new MappedSymbol(action, null, null);
  }
}
