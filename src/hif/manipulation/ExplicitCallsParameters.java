package hif.manipulation;

import hif.model.Call;
import hif.model.Declaration;
import hif.model.Entity;
import hif.model.Instance;
import hif.model.Node;
import hif.model.SubProgram;
import hif.model.TypeDef;
import hif.model.TypeReference;
import hif.model.View;
import hif.model.ViewReference;
import hif.semantics.DeclarationOptions;
import hif.semantics.DeclarationResolver;
import hif.semantics.LanguageSemantics;
import hif.util.TreeWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites every call, type reference, view reference and instance of a subtree so that its
 * actual arguments match the formal list of its declaration: named, in formal order, and with
 * missing arguments completed.
 */
public class ExplicitCallsParameters extends TreeWalker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static class Options {
    /** Stamp positional arguments with the names of their formals. */
    public boolean setNames = true;
    /** Policy for missing arguments; null uses the one of the semantics. */
    public SortMissingKind missing = null;
    /** A symbol without declaration is a fatal error. */
    public boolean error = true;
  }

  private final LanguageSemantics sem;
  private final boolean setNames;
  private final SortMissingKind missing;
  private final DeclarationOptions declOpt = new DeclarationOptions();
  private int sorted = 0;

  private ExplicitCallsParameters(LanguageSemantics sem, Options opt) {
    this.sem = sem;
    this.setNames = opt.setNames;
    this.missing = opt.missing != null ? opt.missing : sem.getSortMissingKind();
    this.declOpt.error = opt.error;
  }

  /**
   * Runs the pass.
   * @return the number of argument lists that were sorted
   * @throws hif.diag.HifException if a declaration is missing (when {@code opt.error} is set) or an
   *   argument list cannot be matched to its formals
   */
  public static int run(Node root, LanguageSemantics sem, Options opt) {
    ExplicitCallsParameters pass = new ExplicitCallsParameters(sem, opt);
    pass.walk(root);
    logger.debug("Sorted {} argument lists under {}", pass.sorted, root);
    return pass.sorted;
  }

  @Override
  protected boolean enter(Node node) {
    if (node instanceof Call)
      sortCall((Call)node);
    else if (node instanceof TypeReference)
      sortTypeReference((TypeReference)node);
    else if (node instanceof ViewReference)
      sortViewReference((ViewReference)node);
    else if (node instanceof Instance)
      sortInstance((Instance)node);
    return true;
  }

  private void sortCall(Call call) {
    Declaration decl = DeclarationResolver.resolve(call, sem, declOpt);
    if (!(decl instanceof SubProgram))
      return;
    // value arguments first: deduction of generic parameters reads them
    SortParameters.sortCall(call, (SubProgram)decl, setNames, missing, sem, false);
    ++sorted;
  }

  private void sortTypeReference(TypeReference ref) {
    Declaration decl = DeclarationResolver.resolve(ref, sem, declOpt);
    if (!(decl instanceof TypeDef))
      return;
    TypeDef td = (TypeDef)decl;
    if (td.templateParameters.isEmpty() && ref.templateParameterAssigns.isEmpty())
      return;
    SortParameters.sortParameters(ref.templateParameterAssigns, td.templateParameters, setNames, missing, sem, false);
    ++sorted;
  }

  private void sortViewReference(ViewReference ref) {
    Declaration decl = DeclarationResolver.resolve(ref, sem, declOpt);
    if (!(decl instanceof View))
      return;
    View view = (View)decl;
    if (view.templateParameters.isEmpty() && ref.templateParameterAssigns.isEmpty())
      return;
    SortParameters.sortParameters(ref.templateParameterAssigns, view.templateParameters, setNames, missing, sem, false);
    ++sorted;
  }

  private void sortInstance(Instance inst) {
    Declaration decl = DeclarationResolver.resolve(inst, sem, declOpt);
    if (!(decl instanceof Entity))
      return;
    SortParameters.sortParameters(inst.portAssigns, ((Entity)decl).ports, setNames, missing, sem, false);
    ++sorted;
  }
}
