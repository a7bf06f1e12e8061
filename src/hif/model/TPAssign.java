package hif.model;

/** Actual argument of a generic (template) parameter. */
public abstract class TPAssign extends ReferencedAssign {
  protected TPAssign(String... slotNames) { super(slotNames); }
}
