package hif.model;

public enum SubProgramKind {
  /** Free subprogram. */
  STATIC("static"),
  /** Method called on an instance that is passed explicitly as first parameter. */
  INSTANCE("instance"),
  /** Method called on an instance, which is not part of the parameter list. */
  IMPLICIT_INSTANCE("implicit_instance");

  public final String serialName;

  private SubProgramKind(String serialName) { this.serialName = serialName; }

  public static SubProgramKind fromSerialName(String name) {
    for (SubProgramKind kind : values())
      if (kind.serialName.equals(name) || kind.name().equals(name))
        return kind;
    throw new IllegalArgumentException("Unknown subprogram kind '" + name + "'");
  }
}
