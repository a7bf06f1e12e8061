package hif.semantics;

import hif.diag.HifException;
import hif.model.Call;
import hif.model.Declaration;
import hif.model.Node;
import hif.model.Symbol;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Binds symbols to the declarations they name.
 * <p>
 * The binding is cached on the symbol. A cached binding is returned as it is until it is reset or a
 * refresh is forced; it is never checked for staleness.
 * </p>
 */
public class DeclarationResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private DeclarationResolver() {}

  public static Declaration resolve(Symbol symbol, LanguageSemantics sem) {
    return resolve(symbol, sem, new DeclarationOptions());
  }

  /**
   * Returns the declaration of a symbol, searching it when it is not cached.
   * The search result (possibly none) is cached on the symbol.
   * @throws HifException if {@code opt.error} is set and the declaration cannot be found, unless the
   *   symbol is allowed to have none (e.g. a field of a native record)
   */
  public static Declaration resolve(Symbol symbol, LanguageSemantics sem, DeclarationOptions opt) {
    if (symbol == null)
      return null;
    if ((symbol.getDeclaration() != null && !opt.forceRefresh) || opt.dontSearch)
      return symbol.getDeclaration();

    DeclarationSearch.Result found = new DeclarationSearch(symbol, sem, opt).run();
    CandidateSelector selector = new CandidateSelector(sem, opt, false);
    Declaration ret;
    if (symbol instanceof Call) {
      boolean atLeastOne = opt instanceof GetCandidatesOptions && ((GetCandidatesOptions)opt).atLeastOne;
      ret = selector.getBestCandidate(found.declarations(), symbol, atLeastOne, null);
    } else {
      ret = selector.checkCandidates(found.declarations(), symbol);
    }
    if (ret == null && opt.error && !found.allowNotFound())
      throw notFound(symbol, sem);
    logger.trace("{} resolved to {}", symbol, ret);
    symbol.setDeclaration(ret);
    return ret;
  }

  /**
   * Sets the cached declaration of a symbol.
   * @param declaration the declaration, or null to clear the binding
   */
  public static void bind(Symbol symbol, Declaration declaration) {
    if (declaration != null && !symbol.getDeclarationType().isInstance(declaration))
      throw new IllegalArgumentException("Cannot bind " + symbol + " to " + declaration + ": expected "
          + symbol.getDeclarationType().getSimpleName());
    symbol.setDeclaration(declaration);
  }

  /** Clears every binding inside a subtree. */
  public static void invalidate(Node subtree) {
    ResetDeclarations.reset(subtree, null, new ResetDeclarationsOptions());
  }

  /**
   * Returns the declarations a symbol may denote.
   * A cached binding is returned alone unless a refresh is forced. For calls, {@code atLeastOne}
   * selects the single best candidate and {@code getAllAssignables} every candidate whose signature
   * accepts the actual arguments; otherwise every visible declaration of the right variant is returned.
   */
  public static List<Declaration> getCandidates(Symbol symbol, LanguageSemantics sem, GetCandidatesOptions opt) {
    List<Declaration> ret = new ArrayList<>();
    if ((symbol.getDeclaration() != null && !opt.forceRefresh) || opt.dontSearch) {
      if (symbol.getDeclaration() != null)
        ret.add(symbol.getDeclaration());
      return ret;
    }

    DeclarationSearch.Result found = new DeclarationSearch(symbol, sem, opt).run();
    if (symbol instanceof Call && !opt.getAll && (opt.atLeastOne || opt.getAllAssignables)) {
      CandidateSelector selector = new CandidateSelector(sem, opt, opt.getAllAssignables);
      Declaration best = selector.getBestCandidate(found.declarations(), symbol, opt.atLeastOne, ret);
      if (best != null)
        ret.add(best);
    } else {
      for (Declaration d : CandidateSelector.removeDuplicates(found.declarations()))
        if (symbol.getDeclarationType().isInstance(d))
          ret.add(d);
    }
    if (ret.isEmpty() && opt.error && !found.allowNotFound())
      throw notFound(symbol, sem);
    return ret;
  }

  private static HifException notFound(Symbol symbol, LanguageSemantics sem) {
    HifException ex = new HifException("Declaration not found", (Node)symbol, sem.getName());
    logger.error(ex.getMessage());
    return ex;
  }
}
