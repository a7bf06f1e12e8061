package hif.semantics;

import hif.model.Declaration;
import hif.model.Node;
import hif.model.ReferencedAssign;
import hif.model.Symbol;
import hif.util.TreeWalker;
import java.util.List;

/**
 * Clears the cached bindings of the symbols in a subtree, children before their parents.
 */
public class ResetDeclarations {
  private final LanguageSemantics sem;
  private final ResetDeclarationsOptions opt;

  private ResetDeclarations(LanguageSemantics sem, ResetDeclarationsOptions opt) {
    if (opt.onlyVisible && sem == null)
      throw new IllegalArgumentException("Resetting only visible declarations requires a semantics");
    this.sem = sem;
    this.opt = opt;
  }

  /**
   * @param sem used to search declarations again with {@code onlyVisible}; may be null otherwise
   */
  public static void reset(Node root, LanguageSemantics sem, ResetDeclarationsOptions opt) {
    if (root != null)
      new ResetDeclarations(sem, opt).visit(root);
  }

  public static void reset(List<? extends Node> roots, LanguageSemantics sem, ResetDeclarationsOptions opt) {
    ResetDeclarations r = new ResetDeclarations(sem, opt);
    for (Node root : roots)
      r.visit(root);
  }

  private void visit(Node node) {
    boolean isSymbol = node instanceof Symbol;
    if (!(opt.onlyCurrent && isSymbol)) {
      Node skipped = (opt.onlySignatures && node instanceof ReferencedAssign) ? ((ReferencedAssign)node).getPayload() : null;
      for (Node child : TreeWalker.children(node))
        if (child != skipped)
          visit(child);
    }
    if (isSymbol)
      resetDeclaration((Symbol)node);
  }

  private void resetDeclaration(Symbol sym) {
    Declaration old = sym.getDeclaration();
    sym.setDeclaration(null);
    if (!opt.onlyVisible)
      return;
    // visible declarations can be found again later: reset them; keep the others
    Declaration found = DeclarationResolver.resolve(sym, sem);
    sym.setDeclaration(found != null ? null : old);
  }
}
