package hif.manipulation;

import hif.TestTrees;
import hif.diag.HifException;
import hif.model.DesignUnit;
import hif.model.Entity;
import hif.model.Function;
import hif.model.FunctionCall;
import hif.model.Identifier;
import hif.model.Instance;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.Parameter;
import hif.model.ParameterAssign;
import hif.model.Port;
import hif.model.PortAssign;
import hif.model.TypeTPAssign;
import hif.model.ReferencedAssign;
import hif.model.View;
import hif.model.ViewReference;
import hif.semantics.HifSemantics;
import hif.semantics.LanguageSemantics;
import hif.semantics.SemanticsRegistry;
import hif.semantics.VerilogSemantics;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExplicitCallsParametersTest {

  private static List<String> names(List<? extends ReferencedAssign> actuals) {
    List<String> ret = new ArrayList<>();
    for (ReferencedAssign a : actuals)
      ret.add(a.getName());
    return ret;
  }

  /** A design calling f(a, b = 5) with a single positional argument. */
  private static FunctionCall callWithDefault(TestTrees trees) {
    Function f = new Function("f", TestTrees.int32());
    f.parameters.add(new Parameter("a", TestTrees.int32(), null));
    f.parameters.add(new Parameter("b", TestTrees.int32(), new IntValue(5)));
    trees.contents.declarations.add(f);
    trees.variable("r", TestTrees.int32());
    FunctionCall call = TestTrees.call("f", new IntValue(3));
    trees.assign(new Identifier("r"), call);
    return call;
  }

  @Test
  void testGenericStandardCall() {
    LanguageSemantics sem = SemanticsRegistry.create(HifSemantics.NAME);
    TestTrees trees = new TestTrees();
    trees.variable("x", TestTrees.int32());
    FunctionCall call = TestTrees.call("max", new Identifier("x"), new IntValue(3));
    trees.assign(new Identifier("x"), call);

    Assertions.assertEquals(1, ExplicitCallsParameters.run(trees.system, sem, new ExplicitCallsParameters.Options()));
    Assertions.assertEquals(List.of("a", "b"), names(call.parameterAssigns));
    Assertions.assertEquals(1, call.templateParameterAssigns.size());
    TypeTPAssign t = (TypeTPAssign)call.templateParameterAssigns.get(0);
    Assertions.assertEquals("T", t.getName());
    Assertions.assertTrue(t.getType() instanceof Int);
    Assertions.assertTrue(((Int)t.getType()).isSigned());
  }

  @Test
  void testMissingPolicyFollowsSemantics() {
    TestTrees hifTrees = new TestTrees();
    FunctionCall hifCall = callWithDefault(hifTrees);
    ExplicitCallsParameters.run(hifTrees.system, new HifSemantics(), new ExplicitCallsParameters.Options());
    Assertions.assertEquals(List.of("a", "b"), names(hifCall.parameterAssigns));

    // limited completion: no named argument follows, nothing is added
    TestTrees verilogTrees = new TestTrees();
    FunctionCall verilogCall = callWithDefault(verilogTrees);
    ExplicitCallsParameters.run(verilogTrees.system, new VerilogSemantics(), new ExplicitCallsParameters.Options());
    Assertions.assertEquals(List.of("a"), names(verilogCall.parameterAssigns));

    TestTrees overridden = new TestTrees();
    FunctionCall overriddenCall = callWithDefault(overridden);
    ExplicitCallsParameters.Options opt = new ExplicitCallsParameters.Options();
    opt.missing = SortMissingKind.ALL;
    opt.setNames = false;
    ExplicitCallsParameters.run(overridden.system, new VerilogSemantics(), opt);
    Assertions.assertEquals(List.of("", "b"), names(overriddenCall.parameterAssigns));
    Assertions.assertEquals(5, ((IntValue)overriddenCall.parameterAssigns.get(1).getValue()).getValue());
  }

  @Test
  void testInstancePorts() {
    TestTrees trees = new TestTrees();
    DesignUnit sub = new DesignUnit("sub");
    View subView = new View("rtl");
    Entity entity = new Entity("sub");
    entity.ports.add(new Port("clk", TestTrees.int32(), null));
    entity.ports.add(new Port("en", TestTrees.int32(), new IntValue(1)));
    entity.ports.add(new Port("rst", TestTrees.int32(), new IntValue(0)));
    subView.setEntity(entity);
    sub.views.add(subView);
    trees.system.designUnits.add(sub);

    Instance inst = new Instance("u0", new ViewReference("sub", "rtl"));
    inst.portAssigns.add(new PortAssign("rst", new IntValue(1)));
    inst.portAssigns.add(new PortAssign("clk", new IntValue(0)));
    trees.contents.instances.add(inst);

    Assertions.assertEquals(1, ExplicitCallsParameters.run(trees.system, new HifSemantics(), new ExplicitCallsParameters.Options()));
    Assertions.assertEquals(List.of("clk", "en", "rst"), names(inst.portAssigns));
    Assertions.assertSame(entity.ports.get(1), inst.portAssigns.get(1).getDeclaration());
    Assertions.assertEquals(1, ((IntValue)inst.portAssigns.get(1).getValue()).getValue());
  }

  @Test
  void testUnresolvedCall() {
    TestTrees trees = new TestTrees();
    trees.variable("r", TestTrees.int32());
    FunctionCall call = TestTrees.call("nowhere", new IntValue(1));
    trees.assign(new Identifier("r"), call);

    Assertions.assertThrows(HifException.class,
        () -> ExplicitCallsParameters.run(trees.system, new HifSemantics(), new ExplicitCallsParameters.Options()));
    ExplicitCallsParameters.Options lenient = new ExplicitCallsParameters.Options();
    lenient.error = false;
    Assertions.assertEquals(0, ExplicitCallsParameters.run(trees.system, new HifSemantics(), lenient));
    Assertions.assertEquals(List.of(""), names(call.parameterAssigns));
  }

  @Test
  void testTooManyArgumentsFail() {
    TestTrees trees = new TestTrees();
    FunctionCall call = callWithDefault(trees);
    call.parameterAssigns.add(new ParameterAssign("", new IntValue(4)));
    call.parameterAssigns.add(new ParameterAssign("", new IntValue(5)));

    // no candidate accepts three arguments
    Assertions.assertThrows(HifException.class,
        () -> ExplicitCallsParameters.run(trees.system, new HifSemantics(), new ExplicitCallsParameters.Options()));
  }
}
