package hif.model;

/** Base of all value (expression) nodes. */
public abstract class Value extends Node {
  protected Value(String... slotNames) { super(slotNames); }
}
