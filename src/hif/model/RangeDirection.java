package hif.model;

public enum RangeDirection {
  UPTO("upto"),
  DOWNTO("downto");

  public final String serialName;

  private RangeDirection(String serialName) { this.serialName = serialName; }

  public static RangeDirection fromSerialName(String name) {
    for (RangeDirection dir : values())
      if (dir.serialName.equals(name) || dir.name().equals(name))
        return dir;
    throw new IllegalArgumentException("Unknown range direction '" + name + "'");
  }
}
