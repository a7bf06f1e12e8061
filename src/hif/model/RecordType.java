package hif.model;

public class RecordType extends Type {
  public final NodeList<Field> fields = addList("fields", Field.class);

  public RecordType() { super(); }

  @Override
  public NodeKind getKind() {
    return NodeKind.RECORD;
  }
}
