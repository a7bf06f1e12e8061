package hif.semantics;

import hif.diag.HifException;
import hif.model.Call;
import hif.model.Declaration;
import hif.model.Instance;
import hif.model.Library;
import hif.model.Node;
import hif.model.Symbol;
import hif.model.TypeReference;
import hif.model.ViewReference;
import hif.util.TreeWalker;
import hif.util.Trees;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves every symbol of a subtree, children before their parents.
 * Bindings already cached are kept unless a refresh is forced or {@code onlyVisible} is set.
 */
public class UpdateDeclarations extends TreeWalker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LanguageSemantics sem;
  private final UpdateDeclarationOptions opt;
  private final DeclarationOptions searchOpt;
  /** Bindings of enclosing calls and references, cleared while their children are updated. */
  private final List<Declaration> saved = new ArrayList<>();

  private UpdateDeclarations(LanguageSemantics sem, UpdateDeclarationOptions opt) {
    this.sem = sem;
    this.opt = opt;
    this.searchOpt = new DeclarationOptions(opt);
    this.searchOpt.error = false;
  }

  public static void update(Node root, LanguageSemantics sem) {
    update(root, sem, new UpdateDeclarationOptions());
  }

  /**
   * @throws HifException if {@code opt.error} is set and a symbol that must be bound has no declaration
   */
  public static void update(Node root, LanguageSemantics sem, UpdateDeclarationOptions opt) {
    new UpdateDeclarations(sem, opt).walk(root);
  }

  public static void update(List<? extends Node> roots, LanguageSemantics sem, UpdateDeclarationOptions opt) {
    UpdateDeclarations walker = new UpdateDeclarations(sem, opt);
    for (Node root : roots)
      walker.walk(root);
  }

  /** Symbols whose children may depend on their own binding during the update. */
  private static boolean clearsBeforeChildren(Node node) {
    return node instanceof Call || node instanceof TypeReference || node instanceof ViewReference || node instanceof Instance;
  }

  @Override
  protected boolean enter(Node node) {
    if (opt.onlyVisible && clearsBeforeChildren(node)) {
      Symbol sym = (Symbol)node;
      saved.add(sym.getDeclaration());
      sym.setDeclaration(null);
    }
    return true;
  }

  @Override
  protected void leave(Node node) {
    if (opt.onlyVisible && clearsBeforeChildren(node)) {
      Symbol sym = (Symbol)node;
      Declaration old = saved.remove(saved.size() - 1);
      if (sym.getDeclaration() == null)
        sym.setDeclaration(old);
    }
    if (node instanceof Symbol)
      updateSymbol((Symbol)node);
  }

  private void updateSymbol(Symbol sym) {
    Declaration decl = getDeclaration(sym);
    if (decl != null || !opt.error)
      return;
    if (sym instanceof Library && ((Library)sym).isSystem())
      return;
    if (sym instanceof Instance && !(((Instance)sym).getReferencedType() instanceof ViewReference
        || ((Instance)sym).getReferencedType() instanceof TypeReference))
      return;
    HifException ex = new HifException("Not found expected declaration of object", (Node)sym, sem.getName());
    logger.error(ex.getMessage());
    throw ex;
  }

  private Declaration getDeclaration(Symbol sym) {
    Declaration old = null;
    if (opt.onlyVisible) {
      old = sym.getDeclaration();
      if (old != null && opt.root != null && !Trees.isSubNode(old, opt.root, true))
        return old;
      sym.setDeclaration(null);
    }
    Declaration found = DeclarationResolver.resolve(sym, sem, searchOpt);
    if (!opt.onlyVisible)
      return found;
    if (found == null || (opt.root != null && !Trees.isSubNode(found, opt.root, true))) {
      // a declaration outside the region is discarded, even when nothing was bound before
      sym.setDeclaration(old);
      return old;
    }
    return found;
  }
}
