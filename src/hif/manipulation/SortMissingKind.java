package hif.manipulation;

/** Policy for actual arguments missing from a call. */
public enum SortMissingKind {
  /** Leave missing arguments missing. */
  NONE("none"),
  /** Synthesize missing arguments only while named arguments remain to be placed. */
  LIMITED("limited"),
  /** Synthesize every missing argument. */
  ALL("all");

  public final String serialName;

  private SortMissingKind(String serialName) {
    this.serialName = serialName;
  }

  public static SortMissingKind fromSerialName(String name) {
    for (SortMissingKind kind : values())
      if (kind.serialName.equalsIgnoreCase(name))
        return kind;
    throw new IllegalArgumentException("Unknown missing argument policy '" + name + "'");
  }
}
