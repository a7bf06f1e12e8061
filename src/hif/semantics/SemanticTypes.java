package hif.semantics;

import hif.compare.Equals;
import hif.diag.Resolution;
import hif.manipulation.InstantiateSignature;
import hif.model.Array;
import hif.model.Bit;
import hif.model.Bitvector;
import hif.model.Bool;
import hif.model.Cast;
import hif.model.ConstValue;
import hif.model.DataDeclaration;
import hif.model.Declaration;
import hif.model.EnumValue;
import hif.model.Expression;
import hif.model.FieldReference;
import hif.model.Function;
import hif.model.FunctionCall;
import hif.model.Identifier;
import hif.model.Int;
import hif.model.Member;
import hif.model.Range;
import hif.model.SubProgram;
import hif.model.Type;
import hif.model.TypeDef;
import hif.model.TypeReference;
import hif.model.Value;
import hif.util.Trees;

/**
 * Semantic typing of values and base type computation.
 * Returned types may be nodes of the tree (e.g. the declared type of a variable) or fresh nodes;
 * callers copy them before attaching them anywhere.
 */
public class SemanticTypes {
  private SemanticTypes() {}

  /**
   * Computes the type of a value, resolving the symbols it depends on.
   * @return the type, or null if it cannot be determined
   */
  public static Type getSemanticType(Value value, LanguageSemantics sem) {
    if (value == null)
      return null;
    switch (value.getKind()) {
    case INT_VALUE:
    case BOOL_VALUE:
    case BIT_VALUE: {
      ConstValue cv = (ConstValue)value;
      return cv.getType() != null ? cv.getType() : sem.getTypeForConstant(cv);
    }
    case IDENTIFIER: {
      Declaration decl = DeclarationResolver.resolve((Identifier)value, sem);
      return getDeclaredType(decl);
    }
    case FIELD_REFERENCE: {
      Declaration decl = DeclarationResolver.resolve((FieldReference)value, sem);
      return getDeclaredType(decl);
    }
    case CAST:
      return ((Cast)value).getType();
    case EXPRESSION: {
      Expression expr = (Expression)value;
      Type t1 = getSemanticType(expr.getValue1(), sem);
      if (t1 == null)
        return null;
      Type t2 = null;
      if (expr.getValue2() != null) {
        t2 = getSemanticType(expr.getValue2(), sem);
        if (t2 == null)
          return null;
      }
      return sem.getExprType(t1, t2, expr.getOperator(), expr).returnedType;
    }
    case MEMBER: {
      Type prefix = getBaseType(getSemanticType(((Member)value).getPrefix(), sem), false, sem);
      if (prefix instanceof Array)
        return ((Array)prefix).getType();
      if (prefix instanceof Bitvector)
        return new Bit(((Bitvector)prefix).isLogic(), ((Bitvector)prefix).isResolved());
      if (prefix instanceof Int)
        return new Bit(false, false);
      return null;
    }
    case FUNCTION_CALL: {
      FunctionCall call = (FunctionCall)value;
      Declaration decl = DeclarationResolver.resolve(call, sem);
      if (!(decl instanceof Function))
        return null;
      Function function = (Function)decl;
      if (function.templateParameters.isEmpty())
        return function.getType();
      Resolution<SubProgram> instantiated = InstantiateSignature.instantiate(call, function, sem);
      if (!instantiated.isFound())
        return null;
      return ((Function)instantiated.value().get()).getType();
    }
    default:
      return null;
    }
  }

  private static Type getDeclaredType(Declaration decl) {
    if (decl instanceof EnumValue && ((EnumValue)decl).getType() == null) {
      TypeDef td = Trees.getNearestParent(decl, TypeDef.class, false).orElse(null);
      if (td == null)
        return null;
      TypeReference ret = new TypeReference(td.getName());
      ret.setDeclaration(td);
      return ret;
    }
    if (decl instanceof DataDeclaration)
      return ((DataDeclaration)decl).getType();
    return null;
  }

  /**
   * Follows type references to the underlying type.
   * References to generic type parameters, and unresolved references, are returned as they are.
   * @param considerOpacity stop at opaque type definitions
   */
  public static Type getBaseType(Type type, boolean considerOpacity, LanguageSemantics sem) {
    Type cur = type;
    // bounded to guard against cyclic type definitions
    for (int depth = 0; depth < 64 && cur instanceof TypeReference; ++depth) {
      Declaration decl = DeclarationResolver.resolve((TypeReference)cur, sem);
      if (!(decl instanceof TypeDef))
        return cur;
      TypeDef td = (TypeDef)decl;
      if ((considerOpacity && td.isOpaque()) || td.getType() == null)
        return cur;
      cur = td.getType();
    }
    return cur;
  }

  /** Returns the span of a scalar or array type, or null. */
  public static Range getSpan(Type type) {
    if (type instanceof Bitvector)
      return ((Bitvector)type).getSpan();
    if (type instanceof Int)
      return ((Int)type).getSpan();
    if (type instanceof Array)
      return ((Array)type).getSpan();
    return null;
  }

  /**
   * Width in elements of a type: 1 for bits and booleans, the constant span size otherwise.
   * @return the width, or 0 if unknown
   */
  public static long getSpanSize(Type type) {
    if (type instanceof Bit || type instanceof Bool)
      return 1;
    return Equals.spanSize(getSpan(type));
  }

  public static boolean isSigned(Type type) {
    if (type instanceof Int)
      return ((Int)type).isSigned();
    if (type instanceof Bitvector)
      return ((Bitvector)type).isSigned();
    if (type instanceof Array)
      return ((Array)type).isSigned();
    return false;
  }

  public static boolean isLogic(Type type) {
    if (type instanceof Bit)
      return ((Bit)type).isLogic();
    if (type instanceof Bitvector)
      return ((Bitvector)type).isLogic();
    return false;
  }

  public static boolean isResolved(Type type) {
    if (type instanceof Bit)
      return ((Bit)type).isResolved();
    if (type instanceof Bitvector)
      return ((Bitvector)type).isResolved();
    return false;
  }

  public static boolean isConstexpr(Type type) {
    if (type instanceof Bit)
      return ((Bit)type).isConstexpr();
    if (type instanceof Bitvector)
      return ((Bitvector)type).isConstexpr();
    if (type instanceof Int)
      return ((Int)type).isConstexpr();
    if (type instanceof Bool)
      return ((Bool)type).isConstexpr();
    return false;
  }

  /** Bits, booleans, integers and bit vectors. */
  public static boolean isScalar(Type type) {
    return type instanceof Bit || type instanceof Bool || type instanceof Int || type instanceof Bitvector;
  }
}
