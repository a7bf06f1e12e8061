package hif.semantics;

import hif.model.Type;

/**
 * Result of typing an operation.
 * Both types are fresh nodes owned by the caller; returnedType is null if the operation is not allowed.
 */
public class ExpressionTypeInfo {
  /** Type of the result. */
  public Type returnedType;
  /** Type the operation is carried out in. */
  public Type operationPrecision;

  public ExpressionTypeInfo() {}
  public ExpressionTypeInfo(Type returnedType, Type operationPrecision) {
    this.returnedType = returnedType;
    this.operationPrecision = operationPrecision;
  }

  public boolean isValid() { return returnedType != null; }
}
