package hif.diag;

import hif.model.Node;

/**
 * Fatal diagnostic raised when an invariant of the tree or of the resolution engine is violated.
 * Carries the offending node and the name of the active language semantics.
 */
public class HifException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Node node;
  private final String semanticsName;

  public HifException(String message, Node node, String semanticsName) {
    super(buildMessage(message, node, semanticsName));
    this.node = node;
    this.semanticsName = semanticsName;
  }

  public HifException(String message, Node node, String semanticsName, Throwable cause) {
    super(buildMessage(message, node, semanticsName), cause);
    this.node = node;
    this.semanticsName = semanticsName;
  }

  /** The node the diagnostic refers to, may be null. */
  public Node getNode() { return node; }
  /** Name of the semantics active when the error was raised, may be null. */
  public String getSemanticsName() { return semanticsName; }

  private static String buildMessage(String message, Node node, String semanticsName) {
    StringBuilder sb = new StringBuilder(message);
    if (node != null)
      sb.append(" [node: ").append(node).append("]");
    if (semanticsName != null)
      sb.append(" [semantics: ").append(semanticsName).append("]");
    return sb.toString();
  }
}
