package hif.util;

import hif.TestTrees;
import hif.model.Assign;
import hif.model.Contents;
import hif.model.Identifier;
import hif.model.IntValue;
import hif.model.Scope;
import hif.model.StateTable;
import hif.model.Variable;
import hif.model.View;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TreesTest {

  @Test
  void testIsSubNode() {
    TestTrees trees = new TestTrees();
    Identifier x = new Identifier("x");
    trees.assign(x, new IntValue(1));

    Assertions.assertTrue(Trees.isSubNode(x, x, true));
    Assertions.assertFalse(Trees.isSubNode(x, x, false));
    Assertions.assertTrue(Trees.isSubNode(x, trees.system, false));
    Assertions.assertFalse(Trees.isSubNode(trees.system, x, false));
    Assertions.assertFalse(Trees.isSubNode(null, x, true));
  }

  @Test
  void testNearestParentAndScope() {
    TestTrees trees = new TestTrees();
    Identifier x = new Identifier("x");
    trees.assign(x, new IntValue(1));

    Assertions.assertSame(trees.process, Trees.getNearestParent(x, StateTable.class, false).orElse(null));
    Assertions.assertSame(trees.view, Trees.getNearestParent(x, View.class, false).orElse(null));
    Assertions.assertTrue(Trees.getNearestParent(trees.system, View.class, true).isEmpty());

    Scope withDeclarations = Trees.getNearestScope(x, true, false, false).orElse(null);
    Assertions.assertSame(trees.process, withDeclarations);
    Scope withLibraries = Trees.getNearestScope(x, false, true, false).orElse(null);
    Assertions.assertSame(trees.contents, withLibraries);
    Scope withTemplates = Trees.getNearestScope(x, false, false, true).orElse(null);
    Assertions.assertSame(trees.view, withTemplates);
  }

  @Test
  void testCopyKeepsOuterBindings() {
    TestTrees trees = new TestTrees();
    Variable v = trees.variable("x", TestTrees.int32());
    Identifier x = new Identifier("x");
    x.setDeclaration(v);
    Assign a = trees.assign(x, new IntValue(1));

    Assign copy = Copier.copy(a);
    Assertions.assertNull(copy.getParent());
    Assertions.assertNotSame(x, copy.getLeftHandSide());
    Assertions.assertSame(v, ((Identifier)copy.getLeftHandSide()).getDeclaration());

    Contents contentsCopy = Copier.copy(trees.contents);
    Identifier copiedRef = TreeWalker.collect(contentsCopy, Identifier.class).get(0);
    Assertions.assertSame(contentsCopy.declarations.get(0), copiedRef.getDeclaration());
  }

  @Test
  void testOwnership() {
    TestTrees trees = new TestTrees();
    IntValue one = new IntValue(1);
    Assign a = trees.assign(new Identifier("x"), one);
    Assertions.assertThrows(IllegalStateException.class, () -> trees.assign(new Identifier("y"), one));

    IntValue two = new IntValue(2);
    Assertions.assertTrue(one.replace(two));
    Assertions.assertNull(one.getParent());
    Assertions.assertSame(two, a.getRightHandSide());
    Assertions.assertFalse(trees.system.replace(new IntValue(3)));
  }

  @Test
  void testIsInTree() {
    TestTrees trees = new TestTrees();
    Variable x = trees.variable("x", TestTrees.int32());
    Assertions.assertTrue(Trees.isInTree(x));
    Assertions.assertSame(trees.system, Trees.getRoot(x));

    x.detach();
    Assertions.assertFalse(Trees.isInTree(x));
    Assertions.assertSame(x, Trees.getRoot(x));
  }
}
