package hif.compare;

/**
 * Toggles of the structural comparison.
 * Public fields with their defaults; copy before changing a shared instance.
 */
public class EqualsOptions {
  //// General ////

  /** Compare only the node variants. */
  public boolean checkOnlyTypes = false;
  /** Compare only the names of named nodes (two unnamed nodes are equal). */
  public boolean checkOnlyNames = false;
  /**
   * Two symbols whose cached declarations are the same non-null declaration are equal,
   * without comparing their children. Declarations are never searched.
   */
  public boolean checkOnlySymbolsDeclarations = false;

  //// Node contents ////

  /** Compare spans of types. */
  public boolean checkSpans = true;
  /** Compare element types of composite types. */
  public boolean checkInnerTypeOfComposite = true;
  /** Compare range constraints of data declarations. */
  public boolean checkDeclarationRangeConstraint = true;
  /** Compare initial values of record fields. */
  public boolean checkFieldsInitialValue = true;
  /** Compare the instance of method calls. */
  public boolean checkReferencedInstance = true;
  /** Compare code positions. */
  public boolean checkCodeInfo = false;

  //// Type flags ////

  public boolean checkConstexprFlag = true;
  public boolean checkLogicFlag = true;
  public boolean checkSignedFlag = true;
  public boolean checkResolvedFlag = true;
  public boolean checkSpanDirection = true;

  //// Special cases ////

  /** If one of two types is constexpr, skip flags and compare spans by size only. */
  public boolean handleConstexprTypes = false;
  /** Compare arrays of bits as bit vectors. */
  public boolean handleVectorTypes = false;
  /** For external type definitions, compare only names. */
  public boolean handleExternalsTypedefs = false;

  //// Limits ////

  /** Compare only the current nodes, not their children (children of signatures are still compared). */
  public boolean skipChildren = false;
  /**
   * An absent child on the first side matches anything on the second side.
   * Used for pattern matching.
   */
  public boolean skipNullBranches = false;
  /** For subprograms and type definitions, compare only signatures; formal names are ignored. */
  public boolean skipDeclarationBodies = false;
  /** For views, compare only the interface. */
  public boolean skipViewContents = false;

  //// Unrelated nodes ////

  /** Two symbols with different cached declarations are not equal (absent caches are ignored). */
  public boolean assureSameSymbolDeclarations = false;

  public EqualsOptions() {}

  public EqualsOptions(EqualsOptions o) {
    this.checkOnlyTypes = o.checkOnlyTypes;
    this.checkOnlyNames = o.checkOnlyNames;
    this.checkOnlySymbolsDeclarations = o.checkOnlySymbolsDeclarations;
    this.checkSpans = o.checkSpans;
    this.checkInnerTypeOfComposite = o.checkInnerTypeOfComposite;
    this.checkDeclarationRangeConstraint = o.checkDeclarationRangeConstraint;
    this.checkFieldsInitialValue = o.checkFieldsInitialValue;
    this.checkReferencedInstance = o.checkReferencedInstance;
    this.checkCodeInfo = o.checkCodeInfo;
    this.checkConstexprFlag = o.checkConstexprFlag;
    this.checkLogicFlag = o.checkLogicFlag;
    this.checkSignedFlag = o.checkSignedFlag;
    this.checkResolvedFlag = o.checkResolvedFlag;
    this.checkSpanDirection = o.checkSpanDirection;
    this.handleConstexprTypes = o.handleConstexprTypes;
    this.handleVectorTypes = o.handleVectorTypes;
    this.handleExternalsTypedefs = o.handleExternalsTypedefs;
    this.skipChildren = o.skipChildren;
    this.skipNullBranches = o.skipNullBranches;
    this.skipDeclarationBodies = o.skipDeclarationBodies;
    this.skipViewContents = o.skipViewContents;
    this.assureSameSymbolDeclarations = o.assureSameSymbolDeclarations;
  }

  /** Options for comparing types regardless of flags and spans. */
  public static EqualsOptions baseTypeOptions() {
    EqualsOptions ret = new EqualsOptions();
    ret.checkSpans = false;
    ret.checkConstexprFlag = false;
    ret.checkLogicFlag = false;
    ret.checkSignedFlag = false;
    ret.checkResolvedFlag = false;
    ret.checkSpanDirection = false;
    return ret;
  }
}
