package hif.manipulation;

import hif.diag.Resolution;
import hif.model.Call;
import hif.model.Declaration;
import hif.model.Function;
import hif.model.FunctionCall;
import hif.model.Node;
import hif.model.Parameter;
import hif.model.SubProgram;
import hif.model.Symbol;
import hif.model.TPAssign;
import hif.semantics.LanguageSemantics;
import hif.semantics.References;
import hif.semantics.UpdateDeclarations;
import hif.util.Copier;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Instantiates the signature of a generic subprogram for a call.
 */
public class InstantiateSignature {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private InstantiateSignature() {}

  /**
   * Returns a detached copy of the candidate's signature (no body) in which every reference to a
   * generic parameter is replaced by the value or type the call binds it to.
   * The call itself is not modified. A candidate without generic parameters is returned as it is.
   * @return the instantiated signature, or the failure of sorting the call's generic actuals
   */
  public static Resolution<SubProgram> instantiate(Call call, SubProgram candidate, LanguageSemantics sem) {
    if (candidate.templateParameters.isEmpty())
      return Resolution.found(candidate);

    for (Declaration tp : candidate.templateParameters)
      UpdateDeclarations.update(tp, sem);
    for (Parameter p : candidate.parameters)
      UpdateDeclarations.update(p, sem);
    if (candidate instanceof Function)
      UpdateDeclarations.update(((Function)candidate).getType(), sem);

    // sort copies of the generic actuals; deduction still looks at the real call
    FunctionCall scratch = new FunctionCall(call.getName());
    for (TPAssign ta : call.getTemplateParameterAssigns())
      scratch.templateParameterAssigns.add(Copier.copy(ta));
    Resolution<Void> sorted = SortParameters.sort(scratch.templateParameterAssigns, candidate.templateParameters,
        true, SortMissingKind.ALL, sem, call);
    if (!sorted.isFound())
      return sorted.castFailure();

    SubProgram signature = Copier.copy(candidate);
    signature.setStateTable(null);
    List<TPAssign> bindings = scratch.templateParameterAssigns;
    for (int i = 0; i < signature.templateParameters.size(); ++i) {
      Declaration tp = signature.templateParameters.get(i);
      Node value = bindings.get(i).getPayload();
      if (value == null)
        continue;
      for (Symbol ref : References.getReferences(tp, signature, sem)) {
        Node refNode = (Node)ref;
        if (refNode.getParent() == null)
          continue;
        refNode.replace(Copier.copy(value));
      }
    }
    signature.templateParameters.clear();
    logger.trace("Instantiated {} for {}", signature, call);
    return Resolution.found(signature);
  }
}
