package hif.semantics;

import hif.model.Declaration;
import hif.model.Node;
import hif.model.Symbol;
import hif.util.TreeWalker;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the symbols bound to a declaration.
 */
public class References {
  private References() {}

  /**
   * Returns, in pre-order, every symbol inside {@code root} (root included) bound to {@code decl}.
   * Unbound symbols carrying the declaration's name are resolved first.
   */
  public static List<Symbol> getReferences(Declaration decl, Node root, LanguageSemantics sem) {
    List<Symbol> ret = new ArrayList<>();
    if (decl == null || root == null)
      return ret;
    DeclarationOptions opt = new DeclarationOptions();
    TreeWalker.forEach(root, node -> {
      if (!(node instanceof Symbol))
        return;
      Symbol sym = (Symbol)node;
      if (sym.getDeclaration() == null && sym.getName().equals(decl.getName()))
        DeclarationResolver.resolve(sym, sem, opt);
      if (sym.getDeclaration() == decl)
        ret.add(sym);
    });
    return ret;
  }
}
