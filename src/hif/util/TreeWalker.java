package hif.util;

import hif.model.Node;
import hif.model.NodeList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Generic depth-first, pre-order walk over slots and owned lists.
 * The children of a node are collected after {@link #enter(Node)} returns, so enter may rewrite
 * the lists of the visited node; children detached later in the walk are still visited.
 */
public abstract class TreeWalker {
  /**
   * Called before the children of a node are visited.
   * @return false to skip the children (and the matching {@link #leave(Node)})
   */
  protected abstract boolean enter(Node node);

  /** Called after all children have been visited. */
  protected void leave(Node node) {}

  public void walk(Node root) {
    if (root == null)
      return;
    if (!enter(root))
      return;
    for (Node child : children(root))
      walk(child);
    leave(root);
  }

  /** Slot children first (in slot order), then the elements of every owned list. */
  public static List<Node> children(Node node) {
    List<Node> ret = new ArrayList<>();
    for (int i = 0; i < node.getSlotCount(); ++i)
      if (node.getSlot(i) != null)
        ret.add(node.getSlot(i));
    for (NodeList<? extends Node> list : node.getLists())
      ret.addAll(list);
    return ret;
  }

  /** Visits every node in pre-order; the predicate returns false to prune a subtree. */
  public static void visit(Node root, Predicate<Node> visitor) {
    new TreeWalker() {
      @Override
      protected boolean enter(Node node) {
        return visitor.test(node);
      }
    }.walk(root);
  }

  public static void forEach(Node root, Consumer<Node> action) {
    visit(root, node -> {
      action.accept(node);
      return true;
    });
  }

  /** Collects every node of a variant in pre-order, including the root. */
  public static <T> List<T> collect(Node root, Class<T> type) {
    List<T> ret = new ArrayList<>();
    forEach(root, node -> {
      if (type.isInstance(node))
        ret.add(type.cast(node));
    });
    return ret;
  }
}
