package hif.model;

/** Base of statement nodes held by state tables. */
public abstract class Action extends Node {
  protected Action(String... slotNames) { super(slotNames); }
}
