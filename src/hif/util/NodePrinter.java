package hif.util;

import hif.model.Node;
import hif.model.NodeList;
import hif.model.Symbol;
import java.util.Map;

/** Indented text dump of a tree, used for logs and by the command line front end. */
public class NodePrinter {
  private final boolean printBindings;

  public NodePrinter(boolean printBindings) {
    this.printBindings = printBindings;
  }

  public String print(Node root) {
    StringBuilder sb = new StringBuilder();
    print(sb, root, 0, null);
    return sb.toString();
  }

  private void print(StringBuilder sb, Node node, int depth, String role) {
    indent(sb, depth);
    if (role != null)
      sb.append(role).append(": ");
    sb.append(node.getKind().serialName);
    Map<String, Object> attrs = node.getAttributes();
    if (!attrs.isEmpty()) {
      sb.append(" ");
      sb.append(attrs);
    }
    if (printBindings && node instanceof Symbol) {
      Symbol sym = (Symbol)node;
      sb.append(sym.getDeclaration() == null ? " -> ?" : " -> " + sym.getDeclaration());
    }
    sb.append("\n");
    for (int i = 0; i < node.getSlotCount(); ++i)
      if (node.getSlot(i) != null)
        print(sb, node.getSlot(i), depth + 1, node.getSlotName(i));
    for (NodeList<? extends Node> list : node.getLists()) {
      if (list.isEmpty())
        continue;
      indent(sb, depth + 1);
      sb.append(list.getName()).append(":\n");
      for (Node element : list)
        print(sb, element, depth + 2, null);
    }
  }

  private static void indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; ++i)
      sb.append("  ");
  }
}
