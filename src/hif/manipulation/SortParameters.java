package hif.manipulation;

import hif.compare.Equals;
import hif.diag.HifException;
import hif.diag.Resolution;
import hif.model.Call;
import hif.model.Cast;
import hif.model.ConstValue;
import hif.model.DataDeclaration;
import hif.model.Declaration;
import hif.model.Node;
import hif.model.NodeList;
import hif.model.Operator;
import hif.model.Parameter;
import hif.model.ParameterAssign;
import hif.model.Port;
import hif.model.PortAssign;
import hif.model.ReferencedAssign;
import hif.model.SubProgram;
import hif.model.Symbol;
import hif.model.TPAssign;
import hif.model.Type;
import hif.model.TypeTP;
import hif.model.TypeTPAssign;
import hif.model.Value;
import hif.model.ValueTP;
import hif.model.ValueTPAssign;
import hif.semantics.LanguageSemantics;
import hif.semantics.References;
import hif.semantics.SemanticTypes;
import hif.semantics.UpdateDeclarationOptions;
import hif.semantics.UpdateDeclarations;
import hif.util.Copier;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reorders the actual arguments of a call, reference or instance to match the formal list of
 * the declaration it refers to, and completes missing arguments.
 * <p>
 * Named actuals take precedence over positional ones. A missing actual is synthesized, in this
 * order, from an actual already bound to the formal, by implicit deduction (generic parameters of
 * calls), or from the formal's default. Defaults referring to earlier generic parameters are
 * rewritten with the values chosen for them in the same call.
 * </p>
 */
public class SortParameters {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LanguageSemantics sem;
  private final boolean setNames;
  private final SortMissingKind missing;
  /** Call providing the arguments generic parameters are deduced from; may be null. */
  private final Call context;

  private SortParameters(LanguageSemantics sem, boolean setNames, SortMissingKind missing, Call context) {
    this.sem = sem;
    this.setNames = setNames;
    this.missing = missing;
    this.context = context;
  }

  /**
   * Sorts an actual list in place.
   * @param setNames stamp positional actuals with the name of the formal they are matched to
   * @param hasCandidate report failures by returning false instead of failing
   * @return true on success; on failure the actual list is left as it was
   * @throws HifException on failure, unless {@code hasCandidate} is set
   */
  public static boolean sortParameters(NodeList<? extends ReferencedAssign> actuals, List<? extends Declaration> formals,
                                       boolean setNames, SortMissingKind missing, LanguageSemantics sem, boolean hasCandidate) {
    Call context = actuals.getOwner() instanceof Call ? (Call)actuals.getOwner() : null;
    Resolution<Void> result = sort(actuals, formals, setNames, missing, sem, context);
    if (result.isFound())
      return true;
    if (hasCandidate) {
      logger.debug("Cannot sort parameters of {}: {}", actuals.getOwner(), result.getReason());
      return false;
    }
    logger.error("Cannot sort parameters of {}: {}", actuals.getOwner(), result.getReason());
    result.orElseThrow(sem.getName());
    return false;
  }

  /**
   * Sorts an actual list in place, reporting failures as a result.
   * @param context the call whose arguments generic parameters are deduced from, or null
   * @return FOUND on success, NO_MATCH or ERROR otherwise; on failure the actual list is left as it was
   */
  public static Resolution<Void> sort(NodeList<? extends ReferencedAssign> actuals, List<? extends Declaration> formals,
                                      boolean setNames, SortMissingKind missing, LanguageSemantics sem, Call context) {
    return new SortParameters(sem, setNames, missing, context).run(actuals, formals);
  }

  private Resolution<Void> run(NodeList<? extends ReferencedAssign> actuals, List<? extends Declaration> formals) {
    List<ReferencedAssign> original = new ArrayList<>(actuals.removeAll());
    List<String> originalNames = new ArrayList<>();
    List<Declaration> originalDeclarations = new ArrayList<>();
    List<ReferencedAssign> named = new ArrayList<>();
    List<ReferencedAssign> unnamed = new ArrayList<>();
    for (ReferencedAssign a : original) {
      originalNames.add(a.getName());
      originalDeclarations.add(a.getDeclaration());
      if (a.isNamed())
        named.add(a);
      else
        unnamed.add(a);
    }

    List<Declaration> placedFormals = new ArrayList<>();
    List<ReferencedAssign> placed = new ArrayList<>();
    for (Declaration formal : formals) {
      ReferencedAssign actual = take(named, formal, true);
      if (actual == null && !unnamed.isEmpty()) {
        actual = unnamed.remove(0);
        if (setNames)
          actual.setName(formal.getName());
      }
      boolean synthesized = false;
      if (actual == null && mustSynthesize(named)) {
        actual = take(named, formal, false);
        if (actual == null)
          actual = take(unnamed, formal, false);
        if (actual != null) {
          actual.setName(formal.getName());
        } else {
          Resolution<ReferencedAssign> made = makeActual(formal, placedFormals, placed);
          if (!made.isFound()) {
            restore(actuals, original, originalNames, originalDeclarations);
            return made.castFailure();
          }
          actual = made.value().get();
          synthesized = true;
        }
      }
      if (actual == null)
        continue;

      if (actual.isNamed() && actual.getName().equals(formal.getName())
          && actual.getDeclarationType().isInstance(formal))
        actual.setDeclaration(formal);
      if (synthesized && actual instanceof ValueTPAssign)
        addEventualCast((ValueTPAssign)actual, (ValueTP)formal);
      actuals.addNode(actual);
      placed.add(actual);
      placedFormals.add(formal);
    }

    if (!named.isEmpty() || !unnamed.isEmpty()) {
      List<ReferencedAssign> leftovers = new ArrayList<>(named);
      leftovers.addAll(unnamed);
      restore(actuals, original, originalNames, originalDeclarations);
      return Resolution.noMatch("Actual parameters without a formal: " + leftovers, actuals.getOwner());
    }

    UpdateDeclarationOptions quiet = new UpdateDeclarationOptions();
    quiet.error = false;
    for (ReferencedAssign a : placed)
      UpdateDeclarations.update(a.getPayload(), sem, quiet);
    return Resolution.found(null);
  }

  private boolean mustSynthesize(List<ReferencedAssign> remainingNamed) {
    switch (missing) {
    case ALL:
      return true;
    case LIMITED:
      return !remainingNamed.isEmpty();
    default:
      return false;
    }
  }

  /**
   * Removes and returns the first actual of a bucket that belongs to a formal.
   * @param byName match by name; otherwise by an already cached binding to the formal
   */
  private static ReferencedAssign take(List<ReferencedAssign> bucket, Declaration formal, boolean byName) {
    for (int i = 0; i < bucket.size(); ++i) {
      ReferencedAssign a = bucket.get(i);
      boolean matches = byName ? a.getName().equals(formal.getName()) : a.getDeclaration() == formal;
      if (matches)
        return bucket.remove(i);
    }
    return null;
  }

  private static void restore(NodeList<? extends ReferencedAssign> actuals, List<ReferencedAssign> original, List<String> names,
                              List<Declaration> declarations) {
    actuals.clear();
    for (int i = 0; i < original.size(); ++i) {
      ReferencedAssign a = original.get(i);
      a.setName(names.get(i));
      a.setDeclaration(declarations.get(i));
      if (a.getParent() != null)
        a.detach();
      actuals.addNode(a);
    }
  }

  private Resolution<ReferencedAssign> makeActual(Declaration formal, List<Declaration> placedFormals, List<ReferencedAssign> placed) {
    ReferencedAssign ret;
    if (formal instanceof TypeTP || formal instanceof ValueTP) {
      if (context != null) {
        Resolution<TPAssign> deduced = ImplicitTemplates.deduce(context, formal, sem);
        if (deduced.getStatus() == Resolution.Status.ERROR)
          return deduced.castFailure();
        if (deduced.isFound()) {
          TPAssign ta = deduced.value().get();
          ta.setDeclaration(formal);
          return Resolution.found(ta);
        }
      }
      ret = makeFromDefault(formal);
    } else if (formal instanceof Parameter || formal instanceof Port) {
      ret = makeFromDefault(formal);
    } else {
      return Resolution.error("Unexpected formal parameter " + formal, formal);
    }
    if (ret == null)
      return Resolution.noMatch("No actual and no default for formal " + formal.getName(), formal);

    fixPreviousReferences(ret, placedFormals, placed);
    ret.setDeclaration(formal);
    return Resolution.found(ret);
  }

  /** Copies the default of a formal into a new actual, or returns null when there is none. */
  private ReferencedAssign makeFromDefault(Declaration formal) {
    Node def = formal instanceof TypeTP ? ((TypeTP)formal).getType() : ((DataDeclaration)formal).getValue();
    if (def == null)
      return null;
    // the copy keeps the bindings of the default, which are only visible from the formal
    UpdateDeclarationOptions quiet = new UpdateDeclarationOptions();
    quiet.error = false;
    UpdateDeclarations.update(def, sem, quiet);
    Node copy = Copier.copy(def);
    switch (formal.getKind()) {
    case TYPE_TP:
      return new TypeTPAssign(formal.getName(), (Type)copy);
    case VALUE_TP: {
      Value v = (Value)copy;
      if (v instanceof ConstValue && ((ConstValue)v).getType() == null)
        ((ConstValue)v).setType(sem.getTypeForConstant((ConstValue)v));
      return new ValueTPAssign(formal.getName(), v);
    }
    case PARAMETER:
      return new ParameterAssign(formal.getName(), (Value)copy);
    case PORT:
      return new PortAssign(formal.getName(), (Value)copy);
    default:
      return null;
    }
  }

  /**
   * Replaces, inside a synthesized actual, the references to earlier generic parameters by copies
   * of the actuals chosen for them.
   */
  private void fixPreviousReferences(ReferencedAssign made, List<Declaration> placedFormals, List<ReferencedAssign> placed) {
    for (int i = 0; i < placedFormals.size(); ++i) {
      Declaration previous = placedFormals.get(i);
      if (!(previous instanceof TypeTP || previous instanceof ValueTP))
        continue;
      Node value = placed.get(i).getPayload();
      if (value == null)
        continue;
      for (Symbol ref : References.getReferences(previous, made, sem)) {
        Node refNode = (Node)ref;
        if (refNode == made)
          continue;
        logger.trace("Replacing reference to {} by {}", previous.getName(), value);
        refNode.replace(Copier.copy(value));
      }
    }
  }

  /** Wraps a synthesized generic value in a cast when it does not fit the declared type. */
  private void addEventualCast(ValueTPAssign actual, ValueTP formal) {
    Type formalType = formal.getType();
    Value value = actual.getValue();
    if (formalType == null || value == null)
      return;
    Type valueType = SemanticTypes.getSemanticType(value, sem);
    if (valueType == null || Equals.equals(valueType, formalType))
      return;
    if (sem.getExprType(formalType, valueType, Operator.CONV, value).isValid())
      return;
    actual.setValue(null);
    actual.setValue(new Cast(value, Copier.copy(formalType)));
  }

  /** Convenience for callers holding a subprogram: sorts both argument lists of a call. */
  static boolean sortCall(Call call, SubProgram sub, boolean setNames, SortMissingKind missing, LanguageSemantics sem,
                          boolean hasCandidate) {
    if (!sortParameters(call.getParameterAssigns(), sub.parameters, setNames, missing, sem, hasCandidate))
      return false;
    if (call.getTemplateParameterAssigns().isEmpty() && sub.templateParameters.isEmpty())
      return true;
    return sortParameters(call.getTemplateParameterAssigns(), sub.templateParameters, setNames, missing, sem, hasCandidate);
  }
}
