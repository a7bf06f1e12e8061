package hif.util;

import hif.model.Node;
import hif.model.Scope;
import hif.model.SystemRoot;
import java.util.Optional;

/**
 * Navigation primitives over parent links. All operations are bounded by the tree depth and keep no state.
 */
public class Trees {
  private Trees() {}

  /**
   * Checks whether {@code parent} is reachable from {@code obj} through parent links.
   * @param matchStarting whether {@code obj == parent} counts as a match
   */
  public static boolean isSubNode(Node obj, Node parent, boolean matchStarting) {
    if (obj == null || parent == null)
      return false;
    if (obj == parent)
      return matchStarting;
    for (Node cur = obj.getParent(); cur != null; cur = cur.getParent())
      if (cur == parent)
        return true;
    return false;
  }

  /**
   * Returns the nearest ancestor of the requested variant.
   * @param matchStarting whether {@code obj} itself may be returned
   */
  public static <T> Optional<T> getNearestParent(Node obj, Class<T> kind, boolean matchStarting) {
    if (obj == null)
      return Optional.empty();
    Node cur = matchStarting ? obj : obj.getParent();
    for (; cur != null; cur = cur.getParent())
      if (kind.isInstance(cur))
        return Optional.of(kind.cast(cur));
    return Optional.empty();
  }

  /**
   * Returns the first scope, starting from {@code obj} itself, able to hold the requested lists.
   * A subprogram is a template scope but holds neither declarations nor libraries;
   * a state table holds declarations only.
   */
  public static Optional<Scope> getNearestScope(Node obj, boolean needDeclarations, boolean needLibraries, boolean needTemplates) {
    for (Node cur = obj; cur != null; cur = cur.getParent()) {
      if (!(cur instanceof Scope))
        continue;
      boolean valid;
      switch (cur.getKind()) {
      case STATE_TABLE:
        valid = !needLibraries && !needTemplates;
        break;
      case FUNCTION:
      case PROCEDURE:
        valid = !needLibraries && !needDeclarations;
        break;
      case CONTENTS:
      case LIBRARY_DEF:
      case SYSTEM:
        valid = !needTemplates;
        break;
      case VIEW:
        valid = true;
        break;
      default:
        valid = false;
        break;
      }
      if (valid)
        return Optional.of((Scope)cur);
    }
    return Optional.empty();
  }

  /** Returns the topmost ancestor (or the node itself). */
  public static Node getRoot(Node obj) {
    Node cur = obj;
    while (cur.getParent() != null)
      cur = cur.getParent();
    return cur;
  }

  /** Checks whether the node hangs below a system root, i.e. is not part of an orphaned subtree. */
  public static boolean isInTree(Node obj) {
    if (obj == null)
      return false;
    return getRoot(obj) instanceof SystemRoot;
  }
}
