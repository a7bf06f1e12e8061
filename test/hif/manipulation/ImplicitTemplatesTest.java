package hif.manipulation;

import hif.TestTrees;
import hif.diag.HifException;
import hif.diag.Resolution;
import hif.model.Bitvector;
import hif.model.Function;
import hif.model.FunctionCall;
import hif.model.Identifier;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.Node;
import hif.model.Parameter;
import hif.model.Range;
import hif.model.RangeDirection;
import hif.model.SubProgram;
import hif.model.TypeReference;
import hif.model.TypeTP;
import hif.model.ValueTP;
import hif.semantics.HifSemantics;
import hif.semantics.LanguageSemantics;
import hif.semantics.SemanticsRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImplicitTemplatesTest {
  private LanguageSemantics sem;

  @BeforeEach
  void setUp() {
    sem = new HifSemantics();
  }

  /** f<N: int>(v: bitvector(N downto N)) */
  private static Function squareSpanFunction() {
    Function f = new Function("f", TestTrees.int32());
    f.templateParameters.add(new ValueTP("N", TestTrees.int32(), null));
    Range span = new Range(new Identifier("N"), new Identifier("N"), RangeDirection.DOWNTO);
    f.parameters.add(new Parameter("v", new Bitvector(span, false, true, true), null));
    return f;
  }

  @Test
  void testTypeDeduction() {
    // f<T>(a: T)
    Function f = new Function("f", TestTrees.int32());
    TypeTP t = new TypeTP("T", null);
    f.templateParameters.add(t);
    f.parameters.add(new Parameter("a", new TypeReference("T"), null));
    Int actual = TestTrees.int32();

    Node found = ImplicitTemplates.getImplicitTemplate(t, f.parameters.get(0).getType(), actual, sem, false);
    Assertions.assertSame(actual, found);
  }

  @Test
  void testValueDeduction() {
    Function f = squareSpanFunction();
    Bitvector actual = new Bitvector(new Range(7, 7), false, true, true);

    Resolution<Node> found = ImplicitTemplates.findImplicitTemplate(f.templateParameters.get(0),
        f.parameters.get(0).getType(), actual, sem);
    Assertions.assertTrue(found.isFound());
    Assertions.assertEquals(7, ((IntValue)found.value().get()).getValue());
  }

  @Test
  void testInconsistentDeduction() {
    Function f = squareSpanFunction();
    Bitvector actual = new Bitvector(new Range(7, 0), false, true, true);

    Resolution<Node> found = ImplicitTemplates.findImplicitTemplate(f.templateParameters.get(0),
        f.parameters.get(0).getType(), actual, sem);
    Assertions.assertEquals(Resolution.Status.ERROR, found.getStatus());
    Assertions.assertNull(ImplicitTemplates.getImplicitTemplate(f.templateParameters.get(0),
        f.parameters.get(0).getType(), actual, sem, true));
    Assertions.assertThrows(HifException.class, () -> ImplicitTemplates.getImplicitTemplate(
        f.templateParameters.get(0), f.parameters.get(0).getType(), actual, sem, false));

    // without the check the first occurrence wins
    LanguageSemantics unchecked = new HifSemantics();
    unchecked.setDeductionConsistencyChecked(false);
    Node first = ImplicitTemplates.getImplicitTemplate(f.templateParameters.get(0),
        f.parameters.get(0).getType(), actual, unchecked, false);
    Assertions.assertEquals(7, ((IntValue)first).getValue());
    // other semantics values keep checking
    Assertions.assertTrue(sem.isDeductionConsistencyChecked());
    Assertions.assertEquals(Resolution.Status.ERROR, ImplicitTemplates.findImplicitTemplate(f.templateParameters.get(0),
        f.parameters.get(0).getType(), actual, sem).getStatus());
    Assertions.assertTrue(SemanticsRegistry.create(HifSemantics.NAME).isDeductionConsistencyChecked());
  }

  @Test
  void testNothingToDeduce() {
    Function f = squareSpanFunction();
    // the parameter does not occur in a plain integer type
    Resolution<Node> found = ImplicitTemplates.findImplicitTemplate(f.templateParameters.get(0),
        TestTrees.int32(), TestTrees.int32(), sem);
    Assertions.assertEquals(Resolution.Status.NO_MATCH, found.getStatus());
    Assertions.assertEquals(Resolution.Status.NO_MATCH,
        ImplicitTemplates.findImplicitTemplate(f.templateParameters.get(0), null, TestTrees.int32(), sem).getStatus());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ImplicitTemplates.findImplicitTemplate(f.parameters.get(0), TestTrees.int32(), TestTrees.int32(), sem));
  }

  @Test
  void testInstantiatedSignature() {
    TestTrees trees = new TestTrees();
    trees.variable("x", TestTrees.int32());
    FunctionCall call = TestTrees.call("max", new Identifier("x"), new IntValue(3));
    trees.assign(new Identifier("x"), call);
    SubProgram max = (SubProgram)sem.getStandardLibrary(HifSemantics.STANDARD_LIBRARY).declarations.get(0);

    SubProgram signature = InstantiateSignature.instantiate(call, max, sem).orElseThrow(sem.getName());
    Assertions.assertNotSame(max, signature);
    Assertions.assertTrue(signature.templateParameters.isEmpty());
    Assertions.assertNull(signature.getParent());
    Assertions.assertTrue(((Function)signature).getType() instanceof Int);
    Assertions.assertTrue(signature.parameters.get(0).getType() instanceof Int);
    // neither the call nor the generic declaration changed
    Assertions.assertTrue(call.templateParameterAssigns.isEmpty());
    Assertions.assertEquals(1, max.templateParameters.size());
    Assertions.assertTrue(max.parameters.get(1).getType() instanceof TypeReference);
  }
}
