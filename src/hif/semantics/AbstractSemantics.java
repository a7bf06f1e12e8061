package hif.semantics;

import hif.compare.Equals;
import hif.compare.EqualsOptions;
import hif.manipulation.SortMissingKind;
import hif.model.Array;
import hif.model.Bit;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.Declaration;
import hif.model.EnumType;
import hif.model.Int;
import hif.model.LibraryDef;
import hif.model.Node;
import hif.model.Operator;
import hif.model.Range;
import hif.model.RecordType;
import hif.model.Type;
import hif.model.TypeReference;
import hif.model.ViewReference;
import hif.util.Copier;
import hif.util.Trees;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Typing rules shared by the dialects, the standard library registry and the symbol mapping table.
 * Subclasses decide which scalar kinds convert into each other and how literals are typed.
 */
public abstract class AbstractSemantics implements LanguageSemantics {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final List<LibraryDef> standardLibraries = new ArrayList<>();
  private final List<LibraryDef> implicitLibraries = new ArrayList<>();
  /** Key: source semantics name, library, symbol; see {@link #mapKey}. */
  private final Map<String, MappedSymbol> symbolMap = new HashMap<>();
  private boolean deductionConsistencyChecked = true;

  protected AbstractSemantics(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }

  //// Standard libraries ////

  /**
   * Adds a predefined library.
   * @param implicitlyVisible whether its declarations are visible without an import
   */
  protected void registerStandardLibrary(LibraryDef lib, boolean implicitlyVisible) {
    lib.setStandard(true);
    standardLibraries.add(lib);
    if (implicitlyVisible)
      implicitLibraries.add(lib);
  }

  @Override
  public LibraryDef getStandardLibrary(String libName) {
    for (LibraryDef lib : standardLibraries)
      if (lib.getName().equals(libName))
        return lib;
    return null;
  }

  @Override
  public List<LibraryDef> getStandardLibraries() {
    return Collections.unmodifiableList(standardLibraries);
  }

  @Override
  public List<LibraryDef> getImplicitLibraries() {
    return Collections.unmodifiableList(implicitLibraries);
  }

  //// Symbol mapping ////

  private static String mapKey(String semName, String libName, String symbolName) {
    return semName + ":" + libName + "." + symbolName;
  }

  protected void addMapping(String srcSemName, String srcLib, String srcSymbol, MappedSymbol target) {
    symbolMap.put(mapKey(srcSemName, srcLib, srcSymbol), target);
  }

  @Override
  public MappedSymbol mapStandardSymbol(Declaration declaration, LanguageSemantics srcSem) {
    LibraryDef lib = Trees.getNearestParent(declaration, LibraryDef.class, false).orElse(null);
    if (lib == null || !lib.isStandard())
      return MappedSymbol.of(MapAction.UNKNOWN);
    MappedSymbol ret = symbolMap.get(mapKey(srcSem.getName(), lib.getName(), declaration.getName()));
    if (ret != null)
      return ret;
    if (srcSem.getName().equals(name))
      return new MappedSymbol(MapAction.MAP_KEEP, lib.getName(), declaration.getName());
    return MappedSymbol.of(MapAction.UNSUPPORTED);
  }

  //// Policy ////

  @Override
  public SortMissingKind getSortMissingKind() {
    return SortMissingKind.ALL;
  }

  @Override
  public boolean isDeductionConsistencyChecked() {
    return deductionConsistencyChecked;
  }
  @Override
  public void setDeductionConsistencyChecked(boolean check) {
    this.deductionConsistencyChecked = check;
  }

  @Override
  public boolean isOperatorAllowed(Operator op) {
    return true;
  }

  @Override
  public boolean isCastAllowed(Type target, Type source) {
    Type t = SemanticTypes.getBaseType(target, false, this);
    Type s = SemanticTypes.getBaseType(source, false, this);
    if (t == null || s == null)
      return false;
    if (SemanticTypes.isScalar(t) && SemanticTypes.isScalar(s))
      return true;
    return isAssignable(t, s);
  }

  /**
   * Whether a value of scalar base type {@code source} converts implicitly to scalar base type
   * {@code target} of a different kind.
   */
  protected abstract boolean isImplicitlyConvertible(Type target, Type source);

  /** Type of relational and logic operation results. */
  protected abstract Type makeConditionType();

  /** Whether logic operators accept integers and vectors as operands. */
  protected abstract boolean allowsNumericConditions();

  //// Expression typing ////

  @Override
  public ExpressionTypeInfo getExprType(Type t1, Type t2, Operator op, Node sourceObj) {
    ExpressionTypeInfo ret = new ExpressionTypeInfo();
    if (!isOperatorAllowed(op) || t1 == null || (!op.isUnary() && t2 == null))
      return ret;
    Type b1 = SemanticTypes.getBaseType(t1, false, this);
    Type b2 = op.isUnary() ? null : SemanticTypes.getBaseType(t2, false, this);

    // generic or unresolved operands: the result keeps the first operand type
    if (b1 instanceof TypeReference || b2 instanceof TypeReference) {
      ret.returnedType = Copier.copy(t1);
      ret.operationPrecision = Copier.copy(t1);
      return ret;
    }

    switch (op.category) {
    case CONVERSION:
      if (isAssignable(b1, b2)) {
        ret.returnedType = Copier.copy(t1);
        ret.operationPrecision = Copier.copy(t1);
      }
      break;
    case ARITHMETIC:
      if (op.isUnary()) {
        if (isNumeric(b1))
          ret.returnedType = Copier.copy(b1);
      } else if (isNumeric(b1) && isNumeric(b2)) {
        ret.returnedType = widest(b1, b2);
      }
      break;
    case RELATIONAL:
      if (isAssignable(b1, b2) || isAssignable(b2, b1)) {
        ret.returnedType = makeConditionType();
        ret.operationPrecision = widest(b1, b2);
      }
      break;
    case LOGIC:
      if (isCondition(b1) && (op.isUnary() || isCondition(b2)))
        ret.returnedType = makeConditionType();
      break;
    case BITWISE:
      if (op.isUnary()) {
        if (isBits(b1))
          ret.returnedType = Copier.copy(b1);
      } else if (isBits(b1) && isBits(b2)) {
        ret.returnedType = widest(b1, b2);
      }
      break;
    case SHIFT:
      if ((isBits(b1) || b1 instanceof Int) && isNumeric(b2))
        ret.returnedType = Copier.copy(b1);
      break;
    case CONCAT:
      if (isBits(b1) && isBits(b2)) {
        long width = SemanticTypes.getSpanSize(b1) + SemanticTypes.getSpanSize(b2);
        boolean logic = SemanticTypes.isLogic(b1) || SemanticTypes.isLogic(b2);
        boolean resolved = SemanticTypes.isResolved(b1) || SemanticTypes.isResolved(b2);
        ret.returnedType = new Bitvector(new Range(width - 1, 0), false, logic, resolved);
      }
      break;
    default:
      break;
    }
    if (ret.returnedType != null && ret.operationPrecision == null)
      ret.operationPrecision = Copier.copy(ret.returnedType);
    if (ret.returnedType == null)
      logger.trace("{}: operator {} not applicable to {} and {}", name, op.serialName, t1, t2);
    return ret;
  }

  /**
   * Assignability of base types: same kind (with compatible element types for composites),
   * or an implicit conversion allowed by the dialect.
   */
  protected boolean isAssignable(Type target, Type source) {
    if (target == null || source == null)
      return false;
    if (target.getKind() == source.getKind()) {
      switch (target.getKind()) {
      case ARRAY: {
        Array t = (Array)target, s = (Array)source;
        long ts = SemanticTypes.getSpanSize(t), ss = SemanticTypes.getSpanSize(s);
        if (ts != 0 && ss != 0 && ts != ss)
          return false;
        return isAssignable(SemanticTypes.getBaseType(t.getType(), false, this),
            SemanticTypes.getBaseType(s.getType(), false, this));
      }
      case RECORD:
      case ENUM:
        return Equals.equals(target, source, EqualsOptions.baseTypeOptions());
      case VIEW_REFERENCE:
        return ((ViewReference)target).getDesignUnit().equals(((ViewReference)source).getDesignUnit());
      default:
        return true;
      }
    }
    if (SemanticTypes.isScalar(target) && SemanticTypes.isScalar(source))
      return isImplicitlyConvertible(target, source);
    return false;
  }

  protected static boolean isNumeric(Type t) {
    return t instanceof Int || t instanceof Bitvector;
  }

  protected static boolean isBits(Type t) {
    return t instanceof Bit || t instanceof Bitvector;
  }

  private boolean isCondition(Type t) {
    if (t instanceof Bool || t instanceof Bit)
      return true;
    return allowsNumericConditions() && isNumeric(t);
  }

  /** Fresh type of an arithmetic or bitwise result: the operand kind with the larger width. */
  private static Type widest(Type b1, Type b2) {
    boolean signed = SemanticTypes.isSigned(b1) && SemanticTypes.isSigned(b2);
    long w1 = SemanticTypes.getSpanSize(b1);
    long w2 = SemanticTypes.getSpanSize(b2);
    if (b1 instanceof Bitvector || b2 instanceof Bitvector) {
      long width = Math.max(w1, w2);
      Range span = width > 0 ? new Range(width - 1, 0) : null;
      return new Bitvector(span, signed, SemanticTypes.isLogic(b1) || SemanticTypes.isLogic(b2),
          SemanticTypes.isResolved(b1) || SemanticTypes.isResolved(b2));
    }
    if (b1 instanceof Int || b2 instanceof Int) {
      long width = Math.max(w1, w2);
      return new Int(width > 0 ? new Range(width - 1, 0) : null, signed);
    }
    Type ret = Copier.copy(w1 >= w2 ? b1 : b2);
    if (ret instanceof Bit)
      ((Bit)ret).setConstexpr(false);
    return ret;
  }

  //// Types ////

  @Override
  public boolean isTypeAllowed(Type type) {
    return type != null;
  }

  /** Returns true for record and enum types, which only the native dialect supports. */
  protected static boolean isUserComposite(Type type) {
    return type instanceof RecordType || type instanceof EnumType;
  }
}
