package hif.semantics;

import hif.model.Node;

public class UpdateDeclarationOptions extends DeclarationOptions {
  /**
   * Re-resolve every symbol, but keep a previous binding when the new one cannot be found or lies
   * outside {@link #root}.
   */
  public boolean onlyVisible = false;
  /** Region the bindings of an onlyVisible update must stay in; null disables the check. */
  public Node root = null;

  public UpdateDeclarationOptions() {}

  public UpdateDeclarationOptions(DeclarationOptions o) {
    super(o);
  }
}
