package hif.diag;

import hif.model.Node;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a speculative resolution step.
 * NO_MATCH is the searchable failure a candidate search reacts to by trying the next alternative;
 * ERROR marks an inconsistency that callers outside candidate search must treat as fatal.
 * @param <T> the result value type
 */
public final class Resolution<T> {
  public enum Status {
    FOUND,
    NO_MATCH,
    ERROR
  }

  private final Status status;
  private final T value;
  private final String reason;
  private final Node node;

  private Resolution(Status status, T value, String reason, Node node) {
    this.status = status;
    this.value = value;
    this.reason = reason;
    this.node = node;
  }

  public static <T> Resolution<T> found(T value) {
    return new Resolution<>(Status.FOUND, value, null, null);
  }
  public static <T> Resolution<T> noMatch(String reason, Node node) {
    return new Resolution<>(Status.NO_MATCH, null, reason, node);
  }
  public static <T> Resolution<T> error(String reason, Node node) {
    return new Resolution<>(Status.ERROR, null, reason, node);
  }

  public Status getStatus() { return status; }
  public boolean isFound() { return status == Status.FOUND; }
  /** The reason of a failure, or null. */
  public String getReason() { return reason; }
  /** The node a failure refers to, or null. */
  public Node getNode() { return node; }

  /** The found value (may be null for FOUND results that carry no value). */
  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  /**
   * Returns the value of a FOUND result, raising a fatal diagnostic otherwise.
   * @param semanticsName name of the active semantics, attached to the diagnostic
   */
  public T orElseThrow(String semanticsName) {
    if (status != Status.FOUND)
      throw new HifException(reason, node, semanticsName);
    return value;
  }

  /** Carries a failure over to a different result type. */
  public <U> Resolution<U> castFailure() {
    if (status == Status.FOUND)
      throw new IllegalStateException("Not a failure");
    return new Resolution<>(status, null, reason, node);
  }

  public <U> Resolution<U> map(Function<T, U> fn) {
    if (status != Status.FOUND)
      return castFailure();
    return found(fn.apply(value));
  }

  @Override
  public String toString() {
    if (status == Status.FOUND)
      return "FOUND(" + value + ")";
    return status + "(" + reason + ")";
  }
}
