package hif.compare;

import hif.TestTrees;
import hif.model.Bit;
import hif.model.Bitvector;
import hif.model.Expression;
import hif.model.Identifier;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.Node;
import hif.model.Operator;
import hif.model.Range;
import hif.util.Copier;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class EqualsTest {

  static Stream<Node> nodes() {
    TestTrees trees = new TestTrees();
    trees.variable("x", TestTrees.int32());
    trees.assign(new Identifier("x"), new Expression(Operator.PLUS, new Identifier("x"), new IntValue(1)));
    return Stream.of(new Bit(true, true), new Bitvector(new Range(7, 0), false, true, false), TestTrees.int32(),
                     new IntValue(42), new Range(3, 0), trees.system, trees.process);
  }

  @ParameterizedTest
  @MethodSource("nodes")
  void testReflexive(Node node) {
    Assertions.assertTrue(Equals.equals(node, node, new EqualsOptions()));
    Assertions.assertTrue(Equals.equals(node, Copier.copy(node), new EqualsOptions()));
  }

  @Test
  void testFlagSensitivity() {
    Bit resolved = new Bit(true, true);
    Bit unresolved = new Bit(true, false);
    EqualsOptions opt = new EqualsOptions();
    Assertions.assertFalse(Equals.equals(resolved, unresolved, opt));
    opt.checkResolvedFlag = false;
    Assertions.assertTrue(Equals.equals(resolved, unresolved, opt));

    Int signed = new Int(new Range(15, 0), true);
    Int unsigned = new Int(new Range(15, 0), false);
    opt = new EqualsOptions();
    Assertions.assertFalse(Equals.equals(signed, unsigned, opt));
    opt.checkSignedFlag = false;
    Assertions.assertTrue(Equals.equals(signed, unsigned, opt));

    Bitvector logic = new Bitvector(new Range(7, 0), false, true, false);
    Bitvector plain = new Bitvector(new Range(7, 0), false, false, false);
    opt = new EqualsOptions();
    Assertions.assertFalse(Equals.equals(logic, plain, opt));
    opt.checkLogicFlag = false;
    Assertions.assertTrue(Equals.equals(logic, plain, opt));
  }

  @Test
  void testSpans() {
    Assertions.assertFalse(Equals.equals(new Int(new Range(15, 0), true), new Int(new Range(31, 0), true)));
    EqualsOptions opt = new EqualsOptions();
    opt.checkSpans = false;
    Assertions.assertTrue(Equals.equals(new Int(new Range(15, 0), true), new Int(new Range(31, 0), true), opt));
  }

  @Test
  void testListLength() {
    EqualsOptions opt = new EqualsOptions();
    List<Node> one = List.of(new IntValue(1));
    List<Node> two = List.of(new IntValue(1), new IntValue(1));
    Assertions.assertFalse(Equals.equalsList(one, two, opt));
    Assertions.assertFalse(Equals.equalsList(List.of(), one, opt));
    Assertions.assertTrue(Equals.equalsList(one, List.of(new IntValue(1)), opt));
  }
}
