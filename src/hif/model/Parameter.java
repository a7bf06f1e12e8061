package hif.model;

import java.util.Map;

public class Parameter extends DataDeclaration {
  private PortDirection direction = PortDirection.IN;

  public Parameter() { super(); }
  public Parameter(String name, Type type, Value value) {
    this();
    setName(name);
    setType(type);
    setValue(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PARAMETER;
  }

  public PortDirection getDirection() { return direction; }
  public void setDirection(PortDirection direction) { this.direction = direction; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    super.collectAttributes(into);
    into.put("direction", direction.serialName);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("direction")) {
      direction = PortDirection.fromSerialName(String.valueOf(value));
      return true;
    }
    return super.setAttribute(key, value);
  }
}
