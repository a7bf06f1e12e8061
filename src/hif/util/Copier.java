package hif.util;

import hif.model.Declaration;
import hif.model.Node;
import hif.model.NodeList;
import hif.model.Symbol;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Deep copy of subtrees. Cached declaration bindings are kept; bindings that point into the copied
 * subtree are redirected to the corresponding copies.
 */
public class Copier {
  private final boolean keepDeclarations;
  private final Map<Node, Node> copies = new IdentityHashMap<>();

  public Copier(boolean keepDeclarations) {
    this.keepDeclarations = keepDeclarations;
  }

  /** Copies a subtree, keeping cached bindings. */
  public static <T extends Node> T copy(T node) {
    return new Copier(true).copyTree(node);
  }

  @SuppressWarnings("unchecked")
  public <T extends Node> T copyTree(T node) {
    if (node == null)
      return null;
    copies.clear();
    Node ret = copyRec(node);
    if (keepDeclarations)
      remap(ret);
    return (T)ret;
  }

  private Node copyRec(Node src) {
    Node dst = src.getKind().create();
    copies.put(src, dst);
    src.getAttributes().forEach(dst::setAttribute);
    dst.setCodeInfo(src.getCodeInfo());
    for (int i = 0; i < src.getSlotCount(); ++i)
      if (src.getSlot(i) != null)
        dst.setSlot(i, copyRec(src.getSlot(i)));
    for (NodeList<? extends Node> srcList : src.getLists()) {
      NodeList<? extends Node> dstList = dst.getList(srcList.getName());
      for (Node element : srcList)
        dstList.addNode(copyRec(element));
    }
    if (keepDeclarations && src instanceof Symbol)
      ((Symbol)dst).setDeclaration(((Symbol)src).getDeclaration());
    return dst;
  }

  private void remap(Node copyRoot) {
    TreeWalker.forEach(copyRoot, node -> {
      if (!(node instanceof Symbol))
        return;
      Symbol sym = (Symbol)node;
      Node mapped = sym.getDeclaration() == null ? null : copies.get(sym.getDeclaration());
      if (mapped instanceof Declaration)
        sym.setDeclaration((Declaration)mapped);
    });
  }
}
