package hif.compare;

import hif.model.Node;
import hif.model.NodeList;
import hif.model.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Given a pattern node inside a reference tree, finds the node at the same position inside another tree.
 * Both trees are walked in lock step along the path from the reference root to the pattern;
 * every node on the path must have the same variant in the matched tree.
 */
public class MatchObject {
  public static class Options {
    /**
     * Relaxes the variant check for types: a position inside a slot of one type can be matched by the
     * slot of the same name in a different type (e.g. the span of an array by the span of a bit vector).
     */
    public boolean matchStructure = false;

    public Options() {}
    public Options(boolean matchStructure) {
      this.matchStructure = matchStructure;
    }
  }

  private MatchObject() {}

  /**
   * @return the matching node in {@code matchedTree}, or null if the shapes do not correspond
   */
  public static Node matchObject(Node pattern, Node referenceTree, Node matchedTree, Options opt) {
    List<Node> path = getPath(pattern, referenceTree);
    if (path.isEmpty())
      return null;
    Node matched = matchedTree;
    for (int i = 0; i + 1 < path.size(); ++i) {
      if (matched == null)
        return null;
      Node refParent = path.get(i);
      Node refChild = path.get(i + 1);
      if (matched.getKind() != refParent.getKind()) {
        if (!opt.matchStructure || !(matched instanceof Type) || !(refParent instanceof Type))
          return null;
      }
      matched = step(refParent, refChild, matched);
    }
    return matched;
  }

  /** Path from the reference root down to the pattern, both included; empty if the pattern is not inside. */
  private static List<Node> getPath(Node pattern, Node referenceTree) {
    List<Node> ret = new ArrayList<>();
    Node cur = pattern;
    while (cur != null) {
      ret.add(cur);
      if (cur == referenceTree)
        break;
      cur = cur.getParent();
    }
    if (cur == null)
      return Collections.emptyList();
    Collections.reverse(ret);
    return ret;
  }

  private static Node step(Node refParent, Node refChild, Node matched) {
    NodeList<?> ownerList = refChild.getOwnerList();
    if (ownerList != null) {
      NodeList<? extends Node> other = matched.getList(ownerList.getName());
      int index = ownerList.indexOf(refChild);
      if (other == null || index >= other.size())
        return null;
      return other.get(index);
    }
    for (int s = 0; s < refParent.getSlotCount(); ++s) {
      if (refParent.getSlot(s) != refChild)
        continue;
      int index = matched.getSlotIndex(refParent.getSlotName(s));
      return index < 0 ? null : matched.getSlot(index);
    }
    return null;
  }
}
