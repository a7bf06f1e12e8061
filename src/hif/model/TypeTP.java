package hif.model;

/** Generic type parameter. The type slot holds its default, if any. */
public class TypeTP extends TypeDeclaration {
  public TypeTP() { super(); }
  public TypeTP(String name, Type defaultType) {
    this();
    setName(name);
    setType(defaultType);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TYPE_TP;
  }
}
