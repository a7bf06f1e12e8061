package hif.compare;

import hif.model.Array;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.Identifier;
import hif.model.Int;
import hif.model.IntValue;
import hif.model.Node;
import hif.model.Range;
import hif.model.RangeDirection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MatchObjectTest {

  @Test
  void testSamePosition() {
    Identifier n = new Identifier("N");
    Int formal = new Int(new Range(n, new IntValue(0), RangeDirection.DOWNTO), false);
    Int actual = new Int(new Range(15, 0), false);

    Node found = MatchObject.matchObject(n, formal, actual, new MatchObject.Options());
    Assertions.assertEquals(15, ((IntValue)found).getValue());
    Assertions.assertSame(actual, MatchObject.matchObject(formal, formal, actual, new MatchObject.Options()));
  }

  @Test
  void testStructureMatching() {
    Identifier n = new Identifier("N");
    Int formal = new Int(new Range(n, new IntValue(0), RangeDirection.DOWNTO), false);
    Bitvector actual = new Bitvector(new Range(7, 0), false, true, true);

    Assertions.assertNull(MatchObject.matchObject(n, formal, actual, new MatchObject.Options()));
    Node found = MatchObject.matchObject(n, formal, actual, new MatchObject.Options(true));
    Assertions.assertEquals(7, ((IntValue)found).getValue());
  }

  @Test
  void testNoCorrespondingNode() {
    Identifier n = new Identifier("N");
    Array formal = new Array(new Bool(), new Range(n, new IntValue(0), RangeDirection.DOWNTO));
    // no span on the other side
    Assertions.assertNull(MatchObject.matchObject(n, formal, new Array(new Bool(), null), new MatchObject.Options()));
    // pattern outside the reference tree
    Assertions.assertNull(MatchObject.matchObject(new Identifier("M"), formal, formal, new MatchObject.Options()));
  }
}
