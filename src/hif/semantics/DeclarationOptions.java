package hif.semantics;

import hif.model.Node;

/**
 * Options of a declaration lookup.
 */
public class DeclarationOptions {
  /** Node the search starts from; null means the symbol itself. */
  public Node location = null;
  /** Ignore the cached declaration and search again. */
  public boolean forceRefresh = false;
  /** Only return the cached declaration, never search. */
  public boolean dontSearch = false;
  /** A declaration that cannot be found is a fatal error. */
  public boolean error = false;
  /** Candidates are accepted even when argument types cannot be computed. */
  public boolean looseTypeChecks = false;

  public DeclarationOptions() {}

  public DeclarationOptions(DeclarationOptions o) {
    this.location = o.location;
    this.forceRefresh = o.forceRefresh;
    this.dontSearch = o.dontSearch;
    this.error = o.error;
    this.looseTypeChecks = o.looseTypeChecks;
  }
}
