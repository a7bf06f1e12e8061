package hif.model;

/** Base of all type nodes. */
public abstract class Type extends Node {
  protected Type(String... slotNames) { super(slotNames); }
}
