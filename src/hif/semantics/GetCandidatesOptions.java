package hif.semantics;

public class GetCandidatesOptions extends DeclarationOptions {
  /** Return every declaration with a matching name, without overload filtering. */
  public boolean getAll = false;
  /** For calls, return the best candidate even if no candidate is assignable. */
  public boolean atLeastOne = false;
  /** For calls, return every assignable candidate instead of the best one. */
  public boolean getAllAssignables = false;

  public GetCandidatesOptions() {}

  public GetCandidatesOptions(DeclarationOptions o) {
    super(o);
  }
}
