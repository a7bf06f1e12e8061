package hif.semantics;

import hif.manipulation.SortMissingKind;
import hif.model.ConstValue;
import hif.model.Declaration;
import hif.model.LibraryDef;
import hif.model.Node;
import hif.model.Operator;
import hif.model.Type;
import hif.model.Value;
import java.util.List;

/**
 * Typing and mapping policy of one HDL dialect.
 * A semantics value is passed explicitly through every resolution and matching call.
 */
public interface LanguageSemantics {
  /** Name used in diagnostics and for lookup in the {@link SemanticsRegistry}. */
  String getName();

  /**
   * Types an operation. With {@link Operator#CONV}, checks whether a value of type t2 can be assigned
   * to type t1.
   * @param t2 null for unary operators
   * @param sourceObj the node being typed, used for diagnostics
   */
  ExpressionTypeInfo getExprType(Type t1, Type t2, Operator op, Node sourceObj);

  /** Returns a fresh default value for the type, or null if the type has none. */
  Value getTypeDefaultValue(Type type, Declaration declaration);

  /** Returns a fresh type for a literal without syntactic type. */
  Type getTypeForConstant(ConstValue constant);

  boolean isTypeAllowed(Type type);
  boolean isCastAllowed(Type target, Type source);
  boolean isOperatorAllowed(Operator op);

  /**
   * Maps a declaration of a standard library of {@code srcSem} into this semantics.
   * Non-standard declarations yield {@link MapAction#UNKNOWN}.
   */
  MappedSymbol mapStandardSymbol(Declaration declaration, LanguageSemantics srcSem);

  /** Returns the predefined library with the given name, or null. */
  LibraryDef getStandardLibrary(String name);
  List<LibraryDef> getStandardLibraries();
  /** Predefined libraries whose declarations are visible without an import. */
  List<LibraryDef> getImplicitLibraries();

  /** Policy for completing actual-argument lists when none is given by the caller. */
  SortMissingKind getSortMissingKind();

  /** Whether every occurrence of a generic parameter must deduce the same binding as the first one. */
  boolean isDeductionConsistencyChecked();
  void setDeductionConsistencyChecked(boolean check);
}
