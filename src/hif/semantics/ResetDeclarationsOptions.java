package hif.semantics;

public class ResetDeclarationsOptions {
  /** Only reset the given node, not its subtree. */
  public boolean onlyCurrent = false;
  /** Only reset symbols whose declaration can be found again from their position. */
  public boolean onlyVisible = false;
  /** Do not descend into actual argument values, types and call instances. */
  public boolean onlySignatures = false;

  public ResetDeclarationsOptions() {}
}
