package hif.model;

import java.util.Objects;

/**
 * Source position of a node, as reported by the front end that created it.
 */
public class CodeInfo {
  private final String fileName;
  private final int line;
  private final int column;

  public CodeInfo(String fileName, int line, int column) {
    this.fileName = fileName;
    this.line = line;
    this.column = column;
  }

  public String getFileName() { return fileName; }
  public int getLine() { return line; }
  public int getColumn() { return column; }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, line, column);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    CodeInfo other = (CodeInfo)obj;
    return Objects.equals(fileName, other.fileName) && line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return fileName + ":" + line + (column > 0 ? ":" + column : "");
  }
}
