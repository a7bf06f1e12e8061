package hif.manipulation;

import hif.TestTrees;
import hif.diag.HifException;
import hif.model.Assign;
import hif.model.Declaration;
import hif.model.FunctionCall;
import hif.model.Identifier;
import hif.model.IntValue;
import hif.semantics.HifSemantics;
import hif.semantics.LanguageSemantics;
import hif.semantics.UpdateDeclarations;
import hif.semantics.VerilogSemantics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MapStandardSymbolsTest {
  private LanguageSemantics hif;
  private LanguageSemantics verilog;
  private TestTrees trees;

  @BeforeEach
  void setUp() {
    hif = new HifSemantics();
    verilog = new VerilogSemantics();
    trees = new TestTrees();
    trees.variable("x", TestTrees.int32());
    trees.variable("y", TestTrees.int32());
  }

  @Test
  void testRenameToTargetLibrary() {
    FunctionCall call = TestTrees.call("clog2", new Identifier("x"));
    trees.assign(new Identifier("y"), call);
    UpdateDeclarations.update(trees.system, hif);

    Assertions.assertEquals(1, MapStandardSymbols.run(trees.system, hif, verilog));
    Assertions.assertEquals("$clog2", call.getName());
    Declaration target = call.getDeclaration();
    Assertions.assertSame(verilog.getStandardLibrary(VerilogSemantics.STANDARD_LIBRARY), target.getParent());
    // user declarations are left alone
    Assertions.assertSame(trees.contents.declarations.get(0), ((Identifier)call.parameterAssigns.get(0).getValue()).getDeclaration());
  }

  @Test
  void testSimplifiedCallIsReplacedByItsArgument() {
    Assign assign = trees.assign(new Identifier("y"), TestTrees.call("$signed", new Identifier("x")));
    UpdateDeclarations.update(trees.system, verilog);

    Assertions.assertEquals(1, MapStandardSymbols.run(trees.system, verilog, hif));
    Assertions.assertTrue(assign.getRightHandSide() instanceof Identifier);
    Assertions.assertEquals("x", ((Identifier)assign.getRightHandSide()).getName());
  }

  @Test
  void testUnsupportedSymbolsAreReportedTogether() {
    trees.assign(new Identifier("y"), TestTrees.call("max", new Identifier("x"), new IntValue(3)));
    trees.assign(new Identifier("x"), TestTrees.call("max", new Identifier("y"), new IntValue(4)));
    FunctionCall clog2 = TestTrees.call("clog2", new Identifier("x"));
    trees.assign(new Identifier("y"), clog2);
    UpdateDeclarations.update(trees.system, hif);

    HifException ex = Assertions.assertThrows(HifException.class, () -> MapStandardSymbols.run(trees.system, hif, verilog));
    Assertions.assertTrue(ex.getMessage().contains("found 2 problems"), ex.getMessage());
    Assertions.assertEquals(VerilogSemantics.NAME, ex.getSemanticsName());
    // supported symbols are mapped even when the pass fails
    Assertions.assertEquals("$clog2", clog2.getName());
  }

  @Test
  void testSameSemanticsKeepsSymbols() {
    FunctionCall call = TestTrees.call("clog2", new Identifier("x"));
    trees.assign(new Identifier("y"), call);
    UpdateDeclarations.update(trees.system, hif);
    Declaration before = call.getDeclaration();

    Assertions.assertEquals(1, MapStandardSymbols.run(trees.system, hif, hif));
    Assertions.assertEquals("clog2", call.getName());
    Assertions.assertSame(before, call.getDeclaration());
  }
}
