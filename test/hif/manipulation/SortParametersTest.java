package hif.manipulation;

import hif.TestTrees;
import hif.diag.HifException;
import hif.model.Expression;
import hif.model.Function;
import hif.model.FunctionCall;
import hif.model.Identifier;
import hif.model.IntValue;
import hif.model.Operator;
import hif.model.Parameter;
import hif.model.ParameterAssign;
import hif.model.TPAssign;
import hif.model.Value;
import hif.model.ValueTP;
import hif.model.ValueTPAssign;
import hif.semantics.HifSemantics;
import hif.semantics.LanguageSemantics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SortParametersTest {
  private LanguageSemantics sem;

  @BeforeEach
  void setUp() {
    sem = new HifSemantics();
  }

  /** f(a, b = 5, c = 6) over 32 bit integers; a default of null leaves the formal mandatory. */
  private static Function function(Integer... defaults) {
    String[] names = {"a", "b", "c"};
    Function f = new Function("f", TestTrees.int32());
    for (int i = 0; i < defaults.length; ++i) {
      Value def = defaults[i] == null ? null : new IntValue(defaults[i]);
      f.parameters.add(new Parameter(names[i], TestTrees.int32(), def));
    }
    return f;
  }

  private static long intArg(FunctionCall call, int pos) {
    return ((IntValue)call.parameterAssigns.get(pos).getValue()).getValue();
  }

  private static List<String> names(FunctionCall call) {
    List<String> ret = new ArrayList<>();
    for (ParameterAssign pa : call.parameterAssigns)
      ret.add(pa.getName());
    return ret;
  }

  @Test
  void testPositionalGetsNamesAndDefaults() {
    Function f = function(null, 5);
    FunctionCall call = TestTrees.call("f", new IntValue(3));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(List.of("a", "b"), names(call));
    Assertions.assertEquals(3, intArg(call, 0));
    Assertions.assertEquals(5, intArg(call, 1));
    Assertions.assertSame(f.parameters.get(0), call.parameterAssigns.get(0).getDeclaration());
    Assertions.assertSame(f.parameters.get(1), call.parameterAssigns.get(1).getDeclaration());
    // the default is copied, never moved
    Assertions.assertNotSame(f.parameters.get(1).getValue(), call.parameterAssigns.get(1).getValue());
    Assertions.assertNotNull(f.parameters.get(1).getValue());
  }

  @Test
  void testNamedTakesPrecedence() {
    Function f = function(null, null);
    FunctionCall call = TestTrees.call("f", new IntValue(7));
    call.parameterAssigns.add(new ParameterAssign("a", new IntValue(3)));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(List.of("a", "b"), names(call));
    Assertions.assertEquals(3, intArg(call, 0));
    Assertions.assertEquals(7, intArg(call, 1));
  }

  @Test
  void testNamedGetsDefaults() {
    Function f = function(null, 5);
    FunctionCall call = new FunctionCall("f");
    call.parameterAssigns.add(new ParameterAssign("a", new IntValue(3)));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(List.of("a", "b"), names(call));
    Assertions.assertEquals(3, intArg(call, 0));
    Assertions.assertEquals(5, intArg(call, 1));
  }

  @Test
  void testWithoutNames() {
    Function f = function(null, null);
    FunctionCall call = TestTrees.call("f", new IntValue(1), new IntValue(2));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, false, SortMissingKind.NONE, sem, false));
    Assertions.assertEquals(List.of("", ""), names(call));
  }

  @Test
  void testLimitedStopsAfterLastNamed() {
    Function f = function(1, 5, 6);
    FunctionCall call = new FunctionCall("f");
    call.parameterAssigns.add(new ParameterAssign("b", new IntValue(9)));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.LIMITED, sem, false));
    Assertions.assertEquals(List.of("a", "b"), names(call));
    Assertions.assertEquals(1, intArg(call, 0));
    Assertions.assertEquals(9, intArg(call, 1));
  }

  @Test
  void testNoneKeepsMissing() {
    Function f = function(null, 5);
    FunctionCall call = TestTrees.call("f", new IntValue(3));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.NONE, sem, false));
    Assertions.assertEquals(List.of("a"), names(call));
  }

  @Test
  void testFailureRestoresActuals() {
    Function f = function((Integer)null);
    FunctionCall call = TestTrees.call("f", new IntValue(1), new IntValue(2));
    List<ParameterAssign> before = new ArrayList<>(call.parameterAssigns);

    Assertions.assertFalse(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, true));
    Assertions.assertEquals(before, new ArrayList<>(call.parameterAssigns));
    Assertions.assertEquals(List.of("", ""), names(call));
    for (ParameterAssign pa : call.parameterAssigns) {
      Assertions.assertSame(call, pa.getParent());
      Assertions.assertNull(pa.getDeclaration());
    }

    Assertions.assertThrows(HifException.class,
        () -> SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(before, new ArrayList<>(call.parameterAssigns));
  }

  @Test
  void testFailureRestoresBindings() {
    Function f = function((Integer)null);
    ParameterAssign named = new ParameterAssign("a", new IntValue(3));
    FunctionCall call = new FunctionCall("f");
    call.parameterAssigns.add(named);
    call.parameterAssigns.add(new ParameterAssign("", new IntValue(4)));

    // 4 has no formal left
    Assertions.assertFalse(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, true));
    Assertions.assertSame(named, call.parameterAssigns.get(0));
    Assertions.assertNull(named.getDeclaration());

    Parameter other = new Parameter("a", TestTrees.int32(), null);
    named.setDeclaration(other);
    Assertions.assertFalse(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, true));
    Assertions.assertSame(other, named.getDeclaration());
  }

  @Test
  void testMissingWithoutDefault() {
    Function f = function(null, null);
    FunctionCall call = TestTrees.call("f", new IntValue(1));

    Assertions.assertFalse(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, true));
    Assertions.assertEquals(List.of(""), names(call));
    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.NONE, sem, true));
    Assertions.assertEquals(List.of("a"), names(call));
  }

  @Test
  void testDefaultsSeeEarlierGenericActuals() {
    // g<i: int = 5, j: int = i + 10>()
    Function g = new Function("g", TestTrees.int32());
    g.templateParameters.add(new ValueTP("i", TestTrees.int32(), new IntValue(5)));
    g.templateParameters.add(new ValueTP("j", TestTrees.int32(),
        new Expression(Operator.PLUS, new Identifier("i"), new IntValue(10))));
    FunctionCall call = new FunctionCall("g");

    Assertions.assertTrue(SortParameters.sortParameters(call.templateParameterAssigns, g.templateParameters, true,
        SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(2, call.templateParameterAssigns.size());
    TPAssign j = call.templateParameterAssigns.get(1);
    Assertions.assertEquals("j", j.getName());
    Assertions.assertSame(g.templateParameters.get(1), j.getDeclaration());
    Expression value = (Expression)((ValueTPAssign)j).getValue();
    Assertions.assertEquals(Operator.PLUS, value.getOperator());
    Assertions.assertEquals(5, ((IntValue)value.getValue1()).getValue());
    Assertions.assertEquals(10, ((IntValue)value.getValue2()).getValue());
    // the default of j still refers to i
    Expression def = (Expression)((ValueTP)g.templateParameters.get(1)).getValue();
    Assertions.assertTrue(def.getValue1() instanceof Identifier);
  }

  @Test
  void testDefaultsSeeSuppliedGenericActuals() {
    // g<i: int = 5, j: int = i + 10>() called with i = 7
    Function g = new Function("g", TestTrees.int32());
    g.templateParameters.add(new ValueTP("i", TestTrees.int32(), new IntValue(5)));
    g.templateParameters.add(new ValueTP("j", TestTrees.int32(),
        new Expression(Operator.PLUS, new Identifier("i"), new IntValue(10))));
    FunctionCall call = new FunctionCall("g");
    call.templateParameterAssigns.add(new ValueTPAssign("i", new IntValue(7)));

    Assertions.assertTrue(SortParameters.sortParameters(call.templateParameterAssigns, g.templateParameters, true,
        SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(2, call.templateParameterAssigns.size());
    Assertions.assertEquals(7, ((IntValue)((ValueTPAssign)call.templateParameterAssigns.get(0)).getValue()).getValue());
    Expression value = (Expression)((ValueTPAssign)call.templateParameterAssigns.get(1)).getValue();
    Assertions.assertEquals(7, ((IntValue)value.getValue1()).getValue());
    Assertions.assertEquals(10, ((IntValue)value.getValue2()).getValue());
  }

  @RepeatedTest(64)
  void testCompleteness_random() {
    long seed = new Random().nextLong();
    try {
      testCompleteness(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testCompleteness with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 68392, -6733423670758169604L})
  void testCompleteness(long seed) {
    Random rand = new Random(seed);
    int count = 1 + rand.nextInt(6);
    Function f = new Function("f", TestTrees.int32());
    for (int i = 0; i < count; ++i)
      f.parameters.add(new Parameter("p" + i, TestTrees.int32(), new IntValue(10 * i)));

    // a positional prefix, then named actuals for some of the remaining formals in random order
    int positional = rand.nextInt(count + 1);
    FunctionCall call = new FunctionCall("f");
    for (int i = 0; i < positional; ++i)
      call.parameterAssigns.add(new ParameterAssign("", new IntValue(100 + i)));
    List<Integer> named = new ArrayList<>();
    for (int i = positional; i < count; ++i)
      if (rand.nextBoolean())
        named.add(i);
    Collections.shuffle(named, rand);
    for (int i : named)
      call.parameterAssigns.add(new ParameterAssign("p" + i, new IntValue(100 + i)));

    Assertions.assertTrue(SortParameters.sortParameters(call.parameterAssigns, f.parameters, true, SortMissingKind.ALL, sem, false));
    Assertions.assertEquals(count, call.parameterAssigns.size());
    for (int i = 0; i < count; ++i) {
      Assertions.assertEquals("p" + i, call.parameterAssigns.get(i).getName());
      long expected = (i < positional || named.contains(i)) ? 100 + i : 10 * i;
      Assertions.assertEquals(expected, intArg(call, i));
    }
  }
}
