package hif.model;

public class EnumType extends Type {
  public final NodeList<EnumValue> values = addList("values", EnumValue.class);

  public EnumType() { super(); }

  @Override
  public NodeKind getKind() {
    return NodeKind.ENUM;
  }
}
