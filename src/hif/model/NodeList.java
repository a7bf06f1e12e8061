package hif.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered list of nodes owned by a container node.
 * Insertion transfers ownership from the caller to the container, removal transfers it back.
 * A node can only be element of one list at a time.
 * @param <T> the element variant
 */
public class NodeList<T extends Node> extends AbstractList<T> {
  private final Node owner;
  private final String name;
  private final Class<T> elementType;
  private final ArrayList<T> elements = new ArrayList<>();

  NodeList(Node owner, String name, Class<T> elementType) {
    this.owner = owner;
    this.name = name;
    this.elementType = elementType;
  }

  /** The node owning this list (the parent of every element). */
  public Node getOwner() { return owner; }
  public String getName() { return name; }
  public Class<T> getElementType() { return elementType; }

  /** Checks whether a node could be inserted into this list. */
  public boolean accepts(Node node) { return elementType.isInstance(node); }

  @Override
  public T get(int index) {
    return elements.get(index);
  }

  @Override
  public int size() {
    return elements.size();
  }

  @Override
  public void add(int index, T element) {
    if (element == null)
      throw new IllegalArgumentException("Owned lists cannot contain null");
    if (!elementType.isInstance(element))
      throw new IllegalArgumentException("List '" + name + "' of " + owner.getKind() + " does not accept " + element.getKind());
    owner.adoptInto(element, this);
    elements.add(index, element);
    ++modCount;
  }

  /** Adds a node whose static type is not known to match; checks it at runtime. */
  public void addNode(Node element) {
    if (!accepts(element))
      throw new IllegalArgumentException("List '" + name + "' of " + owner.getKind() + " does not accept " + element.getKind());
    add(elementType.cast(element));
  }

  @Override
  public T remove(int index) {
    T ret = elements.remove(index);
    ret.release();
    ++modCount;
    return ret;
  }

  @Override
  public T set(int index, T element) {
    T old = remove(index);
    add(index, element);
    return old;
  }

  @Override
  public boolean remove(Object o) {
    for (int i = 0; i < elements.size(); ++i) {
      if (elements.get(i) == o) {
        remove(i);
        return true;
      }
    }
    return false;
  }

  @Override
  public int indexOf(Object o) {
    for (int i = 0; i < elements.size(); ++i)
      if (elements.get(i) == o)
        return i;
    return -1;
  }

  @Override
  public boolean contains(Object o) {
    return indexOf(o) >= 0;
  }

  void replaceElement(Node old, Node replacement) {
    int index = indexOf(old);
    if (index < 0)
      throw new IllegalStateException("Node is not an element of list '" + name + "'");
    if (!elementType.isInstance(replacement))
      throw new IllegalArgumentException("List '" + name + "' of " + owner.getKind() + " does not accept " + replacement.getKind());
    remove(index);
    add(index, elementType.cast(replacement));
  }

  /**
   * Removes every element, returning them in order. Ownership passes to the caller.
   */
  public List<T> removeAll() {
    List<T> ret = new ArrayList<>(elements);
    clear();
    return ret;
  }

  @Override
  public void clear() {
    for (T element : elements)
      element.release();
    elements.clear();
    ++modCount;
  }

  /**
   * Moves every element of another list to the end of this one, keeping the order.
   * @param other the source list, left empty; its element variant must be compatible
   */
  public void transplant(NodeList<? extends Node> other) {
    if (other == this)
      return;
    for (Node element : other.removeAll())
      addNode(element);
  }

  /** Adds all nodes of a plain collection, taking ownership of each. */
  public void addAllNodes(Collection<? extends Node> nodes) {
    for (Node n : nodes)
      addNode(n);
  }
}
