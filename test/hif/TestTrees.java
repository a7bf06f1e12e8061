package hif;

import hif.model.Assign;
import hif.model.Contents;
import hif.model.DesignUnit;
import hif.model.FunctionCall;
import hif.model.Int;
import hif.model.ParameterAssign;
import hif.model.Range;
import hif.model.StateTable;
import hif.model.SystemRoot;
import hif.model.Type;
import hif.model.Value;
import hif.model.Variable;
import hif.model.View;

/**
 * Builds small designs for tests: a system with one design unit, one view and a single process.
 */
public class TestTrees {
  public final SystemRoot system = new SystemRoot("sys");
  public final DesignUnit unit = new DesignUnit("top");
  public final View view = new View("rtl");
  public final Contents contents = new Contents();
  public final StateTable process = new StateTable("proc");

  public TestTrees() {
    system.designUnits.add(unit);
    unit.views.add(view);
    view.setContents(contents);
    contents.stateTables.add(process);
  }

  public static Int int32() {
    return new Int(new Range(31, 0), true);
  }

  public Variable variable(String name, Type type) {
    Variable ret = new Variable(name, type, null);
    contents.declarations.add(ret);
    return ret;
  }

  public Assign assign(Value lhs, Value rhs) {
    Assign ret = new Assign(lhs, rhs);
    process.actions.add(ret);
    return ret;
  }

  /** A call with positional arguments. */
  public static FunctionCall call(String name, Value... args) {
    FunctionCall ret = new FunctionCall(name);
    for (Value arg : args)
      ret.parameterAssigns.add(new ParameterAssign("", arg));
    return ret;
  }
}
