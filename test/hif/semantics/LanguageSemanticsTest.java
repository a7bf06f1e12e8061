package hif.semantics;

import hif.TestTrees;
import hif.manipulation.SortMissingKind;
import hif.model.Bit;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.BoolValue;
import hif.model.Declaration;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.LibraryDef;
import hif.model.Operator;
import hif.model.Range;
import hif.model.Type;
import hif.model.Variable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LanguageSemanticsTest {

  private static Declaration standard(LanguageSemantics sem, String lib, String name) {
    for (Declaration d : sem.getStandardLibrary(lib).declarations)
      if (d.getName().equals(name))
        return d;
    return null;
  }

  @ParameterizedTest
  @ValueSource(strings = {HifSemantics.NAME, VerilogSemantics.NAME})
  void testRegistryCreatesFreshValues(String name) {
    LanguageSemantics a = SemanticsRegistry.create(name);
    LanguageSemantics b = SemanticsRegistry.create(name);
    Assertions.assertEquals(name, a.getName());
    Assertions.assertNotSame(a, b);
    Assertions.assertTrue(SemanticsRegistry.getNames().contains(name));
    Assertions.assertFalse(a.getImplicitLibraries().isEmpty());
    for (LibraryDef lib : a.getStandardLibraries())
      Assertions.assertTrue(lib.isStandard());
  }

  @Test
  void testUnknownSemantics() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> SemanticsRegistry.create("vhdl"));
  }

  @Test
  void testConversions() {
    LanguageSemantics hif = new HifSemantics();
    LanguageSemantics verilog = new VerilogSemantics();
    Bitvector vector = new Bitvector(new Range(7, 0), false, true, true);

    Assertions.assertTrue(hif.getExprType(new Bool(), new Bit(true, false), Operator.CONV, null).isValid());
    Assertions.assertFalse(hif.getExprType(TestTrees.int32(), new Bool(), Operator.CONV, null).isValid());
    Assertions.assertFalse(hif.getExprType(TestTrees.int32(), vector, Operator.CONV, null).isValid());
    Assertions.assertTrue(verilog.getExprType(TestTrees.int32(), vector, Operator.CONV, null).isValid());
    Assertions.assertFalse(verilog.getExprType(TestTrees.int32(), new Bool(), Operator.CONV, null).isValid());
  }

  @Test
  void testArithmeticWidensAndDropsSign() {
    LanguageSemantics sem = new HifSemantics();
    Int narrow = new Int(new Range(7, 0), false);
    ExpressionTypeInfo info = sem.getExprType(TestTrees.int32(), narrow, Operator.PLUS, null);

    Int result = (Int)info.returnedType;
    Assertions.assertEquals(32, SemanticTypes.getSpanSize(result));
    Assertions.assertFalse(result.isSigned());
    Assertions.assertNotNull(info.operationPrecision);
  }

  @Test
  void testConditionTypes() {
    Type hifCondition = new HifSemantics().getExprType(TestTrees.int32(), TestTrees.int32(), Operator.LT, null).returnedType;
    Type verilogCondition = new VerilogSemantics().getExprType(TestTrees.int32(), TestTrees.int32(), Operator.LT, null).returnedType;
    Assertions.assertTrue(hifCondition instanceof Bool);
    Assertions.assertTrue(verilogCondition instanceof Bit);
    Assertions.assertFalse(new HifSemantics().getExprType(TestTrees.int32(), null, Operator.NOT, null).isValid());
    Assertions.assertTrue(new VerilogSemantics().getExprType(TestTrees.int32(), null, Operator.NOT, null).isValid());
  }

  @Test
  void testConstantTypes() {
    LanguageSemantics sem = new HifSemantics();
    Int t = (Int)sem.getTypeForConstant(new IntValue(12));
    Assertions.assertTrue(t.isSigned());
    Assertions.assertTrue(t.isConstexpr());
    Assertions.assertEquals(32, SemanticTypes.getSpanSize(t));
    Assertions.assertTrue(sem.getTypeForConstant(new BoolValue(true)) instanceof Bool);
    Assertions.assertEquals(0, ((IntValue)sem.getTypeDefaultValue(TestTrees.int32(), null)).getValue());
  }

  @Test
  void testSymbolMapping() {
    LanguageSemantics hif = new HifSemantics();
    LanguageSemantics verilog = new VerilogSemantics();

    MappedSymbol clog2 = verilog.mapStandardSymbol(standard(hif, HifSemantics.STANDARD_LIBRARY, "clog2"), hif);
    Assertions.assertEquals(MapAction.MAP_DELETE, clog2.action());
    Assertions.assertEquals("$clog2", clog2.symbolName());
    Assertions.assertEquals(MapAction.UNSUPPORTED,
        verilog.mapStandardSymbol(standard(hif, HifSemantics.STANDARD_LIBRARY, "max"), hif).action());
    Assertions.assertEquals(MapAction.SIMPLIFIED,
        hif.mapStandardSymbol(standard(verilog, VerilogSemantics.STANDARD_LIBRARY, "$signed"), verilog).action());
    Assertions.assertEquals(MapAction.MAP_KEEP,
        hif.mapStandardSymbol(standard(hif, HifSemantics.STANDARD_LIBRARY, "max"), hif).action());
    Assertions.assertEquals(MapAction.UNKNOWN,
        hif.mapStandardSymbol(new Variable("x", TestTrees.int32(), null), verilog).action());
  }

  @Test
  void testMissingArgumentPolicies() {
    Assertions.assertEquals(SortMissingKind.ALL, new HifSemantics().getSortMissingKind());
    Assertions.assertEquals(SortMissingKind.LIMITED, new VerilogSemantics().getSortMissingKind());
    Assertions.assertFalse(new VerilogSemantics().isTypeAllowed(new Bool()));
    Assertions.assertTrue(new HifSemantics().isTypeAllowed(new Bool()));
  }
}
