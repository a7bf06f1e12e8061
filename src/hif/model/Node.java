package hif.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of every HIF tree element.
 * A node owns its children through fixed single-child slots and through ordered owned lists.
 * The parent reference is a non-owning back-reference, maintained by the slot and list operations.
 */
public abstract class Node {
  private Node parent = null;
  private NodeList<?> ownerList = null;
  private CodeInfo codeInfo = null;

  private final String[] slotNames;
  private final Node[] slots;
  private final List<NodeList<? extends Node>> lists = new ArrayList<>();

  protected Node(String... slotNames) {
    this.slotNames = slotNames;
    this.slots = new Node[slotNames.length];
  }

  /** Returns the runtime variant of this node. */
  public abstract NodeKind getKind();

  public Node getParent() { return parent; }

  /** Returns the owned list this node is an element of, or null if held in a slot (or unowned). */
  public NodeList<?> getOwnerList() { return ownerList; }
  public boolean isInList() { return ownerList != null; }

  public CodeInfo getCodeInfo() { return codeInfo; }
  public void setCodeInfo(CodeInfo codeInfo) { this.codeInfo = codeInfo; }

  //// Slots ////

  public int getSlotCount() { return slots.length; }
  public String getSlotName(int index) { return slotNames[index]; }
  public Node getSlot(int index) { return slots[index]; }

  /**
   * Returns the slot index with the given name, or -1.
   */
  public int getSlotIndex(String name) {
    for (int i = 0; i < slotNames.length; ++i)
      if (slotNames[i].equals(name))
        return i;
    return -1;
  }

  /**
   * Places a child into a slot, taking ownership of it.
   * The previous occupant is released (its parent link cleared) and returned to the caller.
   * @param index the slot index
   * @param child the new child, or null to clear the slot
   * @return the previous occupant, or null
   */
  public Node setSlot(int index, Node child) {
    Node old = slots[index];
    if (old == child)
      return null;
    if (child != null)
      adopt(child);
    slots[index] = child;
    if (old != null)
      old.release();
    return old;
  }

  //// Owned lists ////

  protected <T extends Node> NodeList<T> addList(String name, Class<T> elementType) {
    NodeList<T> ret = new NodeList<>(this, name, elementType);
    lists.add(ret);
    return ret;
  }

  /** Returns the owned child lists of this node, in declaration order. */
  public List<NodeList<? extends Node>> getLists() { return Collections.unmodifiableList(lists); }

  public NodeList<? extends Node> getList(String name) {
    for (NodeList<? extends Node> list : lists)
      if (list.getName().equals(name))
        return list;
    return null;
  }

  //// Ownership ////

  void adopt(Node child) {
    if (child.parent != null || child.ownerList != null)
      throw new IllegalStateException("Node " + child.getKind() + " already has an owner; detach it first");
    if (child == this || Node.isAncestor(child, this))
      throw new IllegalArgumentException("A node cannot own one of its ancestors");
    child.parent = this;
  }
  void adoptInto(Node child, NodeList<?> list) {
    adopt(child);
    child.ownerList = list;
  }
  void release() {
    parent = null;
    ownerList = null;
  }

  private static boolean isAncestor(Node candidate, Node of) {
    for (Node cur = of.parent; cur != null; cur = cur.parent)
      if (cur == candidate)
        return true;
    return false;
  }

  /**
   * Detaches this node from its owner.
   * Ownership passes to the caller, who must reattach it or drop it.
   * @return this node
   */
  public Node detach() {
    if (ownerList != null) {
      ownerList.remove(this);
    } else if (parent != null) {
      Node p = parent;
      for (int i = 0; i < p.slots.length; ++i) {
        if (p.slots[i] == this) {
          p.setSlot(i, null);
          break;
        }
      }
    }
    return this;
  }

  /**
   * Replaces this node in its owner by another node, at the same position.
   * This node is detached and its ownership passes to the caller.
   * @param other the replacement; may be null only when this node is held in a slot
   * @return true if the replacement took place, false if this node has no owner
   */
  public boolean replace(Node other) {
    if (other == this)
      return true;
    if (ownerList != null) {
      if (other == null)
        throw new IllegalArgumentException("Cannot replace a list element by null");
      ownerList.replaceElement(this, other);
      return true;
    }
    if (parent == null)
      return false;
    Node p = parent;
    for (int i = 0; i < p.slots.length; ++i) {
      if (p.slots[i] == this) {
        p.setSlot(i, other);
        return true;
      }
    }
    throw new IllegalStateException("Parent of " + getKind() + " does not hold it");
  }

  //// Scalar attributes ////

  /**
   * Collects the scalar attributes of this node (names, flags, literal values).
   * Order is stable; used for copying, printing and YAML serialization.
   */
  public final Map<String, Object> getAttributes() {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    collectAttributes(ret);
    return ret;
  }

  protected void collectAttributes(Map<String, Object> into) {}

  /**
   * Sets a scalar attribute by name.
   * @return false if this node kind has no such attribute
   */
  public boolean setAttribute(String key, Object value) { return false; }

  protected static boolean asBoolean(Object value) {
    if (value instanceof Boolean)
      return (Boolean)value;
    return Boolean.parseBoolean(String.valueOf(value));
  }

  protected static long asLong(Object value) {
    if (value instanceof Number)
      return ((Number)value).longValue();
    return Long.parseLong(String.valueOf(value));
  }

  @Override
  public String toString() {
    String name = (this instanceof NamedNode) ? ((NamedNode)this).getName() : null;
    return getKind().serialName + (name != null ? " " + name : "") + (codeInfo != null ? " @" + codeInfo : "");
  }
}
