package hif.semantics;

import hif.compare.Equals;
import hif.compare.EqualsOptions;
import hif.diag.Resolution;
import hif.manipulation.InstantiateSignature;
import hif.manipulation.SortMissingKind;
import hif.manipulation.SortParameters;
import hif.model.Array;
import hif.model.Bitvector;
import hif.model.Call;
import hif.model.Declaration;
import hif.model.Function;
import hif.model.LibraryDef;
import hif.model.NodeList;
import hif.model.Operator;
import hif.model.Parameter;
import hif.model.ParameterAssign;
import hif.model.Scope;
import hif.model.SubProgram;
import hif.model.Symbol;
import hif.model.Type;
import hif.model.TypeReference;
import hif.util.Copier;
import hif.util.Trees;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Overload resolution for calls.
 * Every candidate subprogram is tried speculatively against copies of the call's actual arguments,
 * and scored by how well each argument type fits the corresponding formal type.
 */
class CandidateSelector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  static final int EQUALS = 512;
  static final int SAME_SPAN = 256;
  static final int SAME_TYPE = 128;
  static final int SAME_BASE = 64;
  static final int ASSIGNABLE = 32;
  static final int FLAGS = 4;
  static final int SCALAR = 4;
  static final int SAME_INSTANCE_TYPE = 2;
  static final int SORTED_PARAMETERS = 1;

  private record Scored(SubProgram decl, int score) {}

  private final LanguageSemantics sem;
  private final DeclarationOptions opt;
  private final boolean getAllAssignables;

  CandidateSelector(LanguageSemantics sem, DeclarationOptions opt, boolean getAllAssignables) {
    this.sem = sem;
    this.opt = opt;
    this.getAllAssignables = getAllAssignables;
  }

  /**
   * Picks the best candidate for a symbol.
   * @param isMandatory whether a candidate with non-assignable arguments is better than none
   * @param assignables when collecting all assignable candidates, receives them (the return value is then null)
   */
  Declaration getBestCandidate(List<Declaration> candidates, Symbol symbol, boolean isMandatory, List<Declaration> assignables) {
    if (candidates.isEmpty())
      return null;
    if (!(symbol instanceof Call))
      return checkCandidates(candidates, symbol);
    Call call = (Call)symbol;

    List<Declaration> unique = removeDuplicates(candidates);
    if (isMandatory && unique.size() == 1)
      return checkCandidates(unique, symbol);

    NodeList<ParameterAssign> actuals = call.getParameterAssigns();
    List<ParameterAssign> restore = actuals.removeAll();
    List<Scored> best = new ArrayList<>();
    List<Scored> worst = new ArrayList<>();
    try {
      int candidateIndex = 0;
      for (Declaration decl : unique) {
        ++candidateIndex;
        actuals.clear();
        for (ParameterAssign pa : restore)
          actuals.add(Copier.copy(pa));
        scoreCandidate(call, decl, candidateIndex, actuals, restore, best, worst);
      }
    } finally {
      actuals.clear();
      actuals.addAll(restore);
    }

    List<Declaration> normal = getGreatestCandidates(best);
    if (getAllAssignables) {
      if (assignables != null)
        assignables.addAll(normal);
      return null;
    }
    if (!normal.isEmpty())
      return checkCandidates(normal, symbol);

    List<Declaration> worstNormal = getGreatestCandidates(worst);
    if (!worstNormal.isEmpty() && isMandatory)
      return checkCandidates(worstNormal, symbol);

    logger.debug("No candidate left for call {}", symbol);
    return null;
  }

  private void scoreCandidate(Call call, Declaration decl, int candidateIndex, NodeList<ParameterAssign> actuals,
                              List<ParameterAssign> original, List<Scored> best, List<Scored> worst) {
    if (!(decl instanceof SubProgram)) {
      reject(decl, candidateIndex, "is not a subprogram");
      return;
    }
    SubProgram sub = (SubProgram)decl;
    if (actuals.size() > sub.parameters.size()) {
      reject(sub, candidateIndex, "more actual parameters than formal ones");
      return;
    }
    if (call.getTemplateParameterAssigns().size() > sub.templateParameters.size()) {
      reject(sub, candidateIndex, "more actual template parameters than formal ones");
      return;
    }
    if (!SortParameters.sortParameters(actuals, sub.parameters, true, SortMissingKind.ALL, sem, true)) {
      reject(sub, candidateIndex, "parameters cannot be sorted");
      return;
    }
    for (Parameter formal : sub.parameters) {
      if (formal.getValue() != null)
        continue;
      boolean matched = false;
      for (ParameterAssign pa : actuals) {
        if (pa.getName().equals(formal.getName())) {
          matched = true;
          break;
        }
      }
      if (!matched) {
        reject(sub, candidateIndex, "formal parameter " + formal.getName() + " has no actual");
        return;
      }
    }

    Resolution<SubProgram> instantiated = InstantiateSignature.instantiate(call, sub, sem);
    if (!instantiated.isFound()) {
      reject(sub, candidateIndex, "signature instantiation fails: " + instantiated.getReason());
      return;
    }
    SubProgram signature = instantiated.value().get();

    int score = 0;
    boolean skip = false;
    for (int i = 0; i < actuals.size(); ++i) {
      if (i >= signature.parameters.size()) {
        skip = true;
        break;
      }
      ParameterAssign actual = actuals.get(i);
      Parameter formal = signature.parameters.get(i);
      Type actualType = SemanticTypes.getSemanticType(actual.getValue(), sem);
      Type formalType = formal.getType();
      if (formalType == null || actualType == null) {
        if (!opt.looseTypeChecks)
          logger.debug("Cannot type parameter {} of candidate #{} {}", formal.getName(), candidateIndex, sub);
        continue;
      }
      if (!sem.getExprType(formalType, actualType, Operator.CONV, actual).isValid()) {
        logger.debug("Candidate #{} {}: no conversion for parameter {} from {} to {}", candidateIndex, sub,
            formal.getName(), actualType, formalType);
        skip = true;
      }
      score += calculateScore(formalType, actualType);
    }

    score += scoreInstance(call, sub, signature);

    EqualsOptions names = new EqualsOptions();
    names.checkOnlyNames = true;
    if (Equals.equalsList(original, actuals, names))
      score += SORTED_PARAMETERS;

    if (skip)
      worst.add(new Scored(sub, score));
    else
      best.add(new Scored(sub, score));
  }

  /** Methods of standard libraries called on an instance prefer matching scalarity and logic flags. */
  private int scoreInstance(Call call, SubProgram sub, SubProgram signature) {
    if (call.getInstance() == null || !(signature instanceof Function))
      return 0;
    if (!(sub.getParent() instanceof LibraryDef) || !((LibraryDef)sub.getParent()).isStandard())
      return 0;
    Type t = SemanticTypes.getSemanticType(call.getInstance(), sem);
    if (t == null)
      return 0;
    Type returned = ((Function)signature).getType();
    int ret = 0;
    boolean callerIsScalar = !isVector(t);
    boolean functionIsScalar = !isVector(returned);
    if (callerIsScalar != functionIsScalar)
      ret += SCALAR;
    if (t instanceof TypeReference && SemanticTypes.getBaseType(t, false, sem) instanceof TypeReference)
      ret += SAME_INSTANCE_TYPE;
    else if (SemanticTypes.isLogic(returned) == SemanticTypes.isLogic(t))
      ret += SAME_INSTANCE_TYPE;
    return ret;
  }

  private static boolean isVector(Type t) {
    return t instanceof Array || t instanceof Bitvector;
  }

  int calculateScore(Type formal, Type actual) {
    if (Equals.equals(actual, formal))
      return EQUALS;
    EqualsOptions onlyTypes = new EqualsOptions();
    onlyTypes.checkOnlyTypes = true;

    Type formalBase = SemanticTypes.getBaseType(formal, false, sem);
    Type actualBase = SemanticTypes.getBaseType(actual, false, sem);

    int ret = 0;
    if (Equals.equals(actual, formal, onlyTypes)) {
      long actualSize = SemanticTypes.getSpanSize(actualBase);
      long formalSize = SemanticTypes.getSpanSize(formalBase);
      if (actualSize == 0 || formalSize == 0)
        ret = SAME_TYPE;
      else if (formalSize >= actualSize)
        ret = SAME_SPAN;
    } else if (Equals.equals(actualBase, formalBase, onlyTypes)) {
      ret = SAME_BASE;
    }

    int flags = ret == 0 ? ASSIGNABLE : ret;
    // flags would make signed and unsigned overloads differ when only assignability matters
    if (getAllAssignables)
      return flags;
    if (actualBase instanceof TypeReference || formalBase instanceof TypeReference)
      return flags;
    if (SemanticTypes.isSigned(formalBase) == SemanticTypes.isSigned(actualBase))
      flags += FLAGS;
    if (SemanticTypes.isLogic(formalBase) == SemanticTypes.isLogic(actualBase))
      flags += FLAGS;
    if (SemanticTypes.isResolved(formalBase) == SemanticTypes.isResolved(actualBase))
      flags += FLAGS;
    if (SemanticTypes.isConstexpr(formalBase) == SemanticTypes.isConstexpr(actualBase))
      flags += FLAGS;
    return flags;
  }

  /** Candidates with the highest score; non-generic ones win over generic ones. */
  private static List<Declaration> getGreatestCandidates(List<Scored> scored) {
    List<Declaration> ret = new ArrayList<>();
    if (scored.isEmpty())
      return ret;
    int max = scored.stream().max(Comparator.comparingInt(Scored::score)).get().score();
    List<Declaration> generic = new ArrayList<>();
    for (Scored s : scored) {
      if (s.score() != max)
        continue;
      if (s.decl().templateParameters.isEmpty())
        ret.add(s.decl());
      else
        generic.add(s.decl());
    }
    if (ret.isEmpty())
      ret.addAll(generic);
    return ret;
  }

  private void reject(Declaration decl, int candidateIndex, String reason) {
    logger.debug("Candidate #{} {} removed: {}", candidateIndex, decl, reason);
  }

  static List<Declaration> removeDuplicates(List<Declaration> list) {
    List<Declaration> ret = new ArrayList<>();
    for (Declaration d : list) {
      boolean present = false;
      for (Declaration r : ret) {
        if (r == d) {
          present = true;
          break;
        }
      }
      if (!present)
        ret.add(d);
    }
    return ret;
  }

  /**
   * Keeps the candidates of the symbol's declaration variant and returns the first one.
   * Two survivors declared in the same scope are reported as ambiguous.
   */
  Declaration checkCandidates(List<Declaration> candidates, Symbol symbol) {
    List<Declaration> valid = new ArrayList<>();
    for (Declaration d : removeDuplicates(candidates))
      if (symbol.getDeclarationType().isInstance(d))
        valid.add(d);
    if (valid.isEmpty())
      return null;
    Declaration first = valid.get(0);
    if (valid.size() == 1)
      return first;

    boolean conflicting = false;
    for (int i = 0; i < valid.size() && !conflicting; ++i) {
      Scope scopeI = Trees.getNearestParent(valid.get(i), Scope.class, false).orElse(null);
      for (int j = i + 1; j < valid.size(); ++j) {
        if (scopeI == Trees.getNearestParent(valid.get(j), Scope.class, false).orElse(null)) {
          conflicting = true;
          break;
        }
      }
    }
    if (conflicting)
      logger.warn("For {}, more than one meaning exists (semantics {}): keeping {}", first.getName(), sem.getName(), first);
    return first;
  }
}
