package hif.model;

public enum PortDirection {
  NONE("none"),
  IN("in"),
  OUT("out"),
  INOUT("inout");

  public final String serialName;

  private PortDirection(String serialName) { this.serialName = serialName; }

  public static PortDirection fromSerialName(String name) {
    for (PortDirection dir : values())
      if (dir.serialName.equals(name) || dir.name().equals(name))
        return dir;
    throw new IllegalArgumentException("Unknown port direction '" + name + "'");
  }
}
