package hif.manipulation;

import hif.compare.Equals;
import hif.compare.EqualsOptions;
import hif.compare.MatchObject;
import hif.diag.Resolution;
import hif.model.Call;
import hif.model.ConstValue;
import hif.model.Declaration;
import hif.model.Node;
import hif.model.NodeList;
import hif.model.Parameter;
import hif.model.ParameterAssign;
import hif.model.SubProgram;
import hif.model.SubProgramKind;
import hif.model.Symbol;
import hif.model.TPAssign;
import hif.model.Type;
import hif.model.TypeTP;
import hif.model.TypeTPAssign;
import hif.model.Value;
import hif.model.ValueTP;
import hif.model.ValueTPAssign;
import hif.semantics.DeclarationResolver;
import hif.semantics.LanguageSemantics;
import hif.semantics.References;
import hif.semantics.SemanticTypes;
import hif.util.Copier;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Deduction of generic parameters from the types of actual arguments.
 * <p>
 * The generic parameter is located inside the still-generic formal shape, and the node at the same
 * position inside the concrete actual shape is its binding. Every occurrence of the parameter must
 * agree with the first one.
 * </p>
 */
public class ImplicitTemplates {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private ImplicitTemplates() {}

  /**
   * Deduces the binding of a generic parameter.
   * @param hasCandidate report an inconsistent deduction as absent instead of failing
   * @return the node of {@code actualShape} bound to the parameter (not a copy), or null
   * @throws hif.diag.HifException if the occurrences disagree and {@code hasCandidate} is not set
   */
  public static Node getImplicitTemplate(Declaration tp, Node formalShape, Node actualShape, LanguageSemantics sem,
                                         boolean hasCandidate) {
    Resolution<Node> ret = findImplicitTemplate(tp, formalShape, actualShape, sem);
    if (ret.getStatus() == Resolution.Status.ERROR && !hasCandidate) {
      logger.error(ret.getReason());
      return ret.orElseThrow(sem.getName());
    }
    return ret.value().orElse(null);
  }

  public static Resolution<Node> findImplicitTemplate(Declaration tp, Node formalShape, Node actualShape, LanguageSemantics sem) {
    if (!(tp instanceof TypeTP || tp instanceof ValueTP))
      throw new IllegalArgumentException("Not a generic parameter: " + tp);
    if (formalShape == null || actualShape == null)
      return Resolution.noMatch("Nothing to deduce " + tp.getName() + " from", tp);

    List<Symbol> refs = References.getReferences(tp, formalShape, sem);
    if (refs.isEmpty())
      return Resolution.noMatch(tp.getName() + " does not occur in " + formalShape, tp);

    MatchObject.Options matchOpt = new MatchObject.Options(true);
    Node first = MatchObject.matchObject((Node)refs.get(0), formalShape, actualShape, matchOpt);
    if (first == null)
      return Resolution.noMatch("Shapes of " + formalShape + " and " + actualShape + " do not correspond", tp);
    if (tp instanceof TypeTP ? !(first instanceof Type) : !(first instanceof Value))
      return Resolution.noMatch("Binding " + first + " does not fit " + tp, tp);

    if (sem.isDeductionConsistencyChecked()) {
      EqualsOptions opt = new EqualsOptions();
      opt.checkConstexprFlag = false;
      opt.handleConstexprTypes = true;
      for (int i = 1; i < refs.size(); ++i) {
        Node other = MatchObject.matchObject((Node)refs.get(i), formalShape, actualShape, matchOpt);
        if (other != null && !Equals.equals(first, other, opt))
          return Resolution.error("Inconsistent deduction of " + tp.getName() + ": " + first + " and " + other, tp);
      }
    }
    return Resolution.found(first);
  }

  /**
   * Deduces a generic parameter of the subprogram a call refers to, from the call's arguments or,
   * for methods, from the instance it is called on.
   * @return a new actual for the parameter, NO_MATCH if nothing binds it, ERROR on inconsistency
   */
  static Resolution<TPAssign> deduce(Call call, Declaration tp, LanguageSemantics sem) {
    if (!(tp.getParent() instanceof SubProgram))
      return Resolution.noMatch(tp.getName() + " is not a parameter of a subprogram", tp);
    SubProgram sub = (SubProgram)tp.getParent();

    NodeList<ParameterAssign> actuals = call.getParameterAssigns();
    boolean allNamed = actuals.stream().allMatch(ParameterAssign::isNamed);
    for (int i = 0; i < sub.parameters.size(); ++i) {
      Parameter formal = sub.parameters.get(i);
      ParameterAssign actual = null;
      if (allNamed) {
        for (ParameterAssign pa : actuals)
          if (pa.getName().equals(formal.getName()))
            actual = pa;
      } else if (i < actuals.size()) {
        actual = actuals.get(i);
      }
      if (actual == null || actual.getValue() == null || formal.getType() == null)
        continue;
      Type actualType = SemanticTypes.getSemanticType(actual.getValue(), sem);
      if (actualType == null)
        continue;
      Type formalBase = SemanticTypes.getBaseType(formal.getType(), false, sem);
      Type actualBase = SemanticTypes.getBaseType(actualType, false, sem);
      Resolution<Node> found = findImplicitTemplate(tp, formalBase, actualBase, sem);
      if (found.getStatus() == Resolution.Status.ERROR)
        return found.castFailure();
      if (found.isFound())
        return Resolution.found(makeAssign(tp, found.value().get(), sem));
    }

    if (tp instanceof TypeTP && call.getInstance() != null && sub.getSubProgramKind() == SubProgramKind.IMPLICIT_INSTANCE) {
      Type instanceType = SemanticTypes.getSemanticType(call.getInstance(), sem);
      if (instanceType != null)
        return Resolution.found(makeAssign(tp, instanceType, sem));
    }
    return Resolution.noMatch("No argument binds " + tp.getName(), tp);
  }

  private static TPAssign makeAssign(Declaration tp, Node binding, LanguageSemantics sem) {
    Node copy = Copier.copy(binding);
    TPAssign ret;
    if (tp instanceof TypeTP) {
      ret = new TypeTPAssign(tp.getName(), (Type)copy);
    } else {
      Value v = (Value)copy;
      if (v instanceof ConstValue && ((ConstValue)v).getType() == null)
        ((ConstValue)v).setType(sem.getTypeForConstant((ConstValue)v));
      ret = new ValueTPAssign(tp.getName(), v);
    }
    DeclarationResolver.bind(ret, tp);
    logger.debug("Deduced {} = {}", tp.getName(), binding);
    return ret;
  }
}
