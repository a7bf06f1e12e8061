package hif.model;

import java.util.Map;

public class FunctionCall extends Value implements Call {
  private static final int INSTANCE = 0;

  public final NodeList<TPAssign> templateParameterAssigns = addList("templateParameterAssigns", TPAssign.class);
  public final NodeList<ParameterAssign> parameterAssigns = addList("parameterAssigns", ParameterAssign.class);

  private String name = "";
  private Declaration declaration = null;

  public FunctionCall() { super("instance"); }
  public FunctionCall(String name) {
    this();
    setName(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_CALL;
  }

  @Override
  public Value getInstance() {
    return (Value)getSlot(INSTANCE);
  }
  @Override
  public Value setInstance(Value instance) {
    return (Value)setSlot(INSTANCE, instance);
  }
  @Override
  public NodeList<TPAssign> getTemplateParameterAssigns() {
    return templateParameterAssigns;
  }
  @Override
  public NodeList<ParameterAssign> getParameterAssigns() {
    return parameterAssigns;
  }

  @Override
  public String getName() {
    return name;
  }
  @Override
  public void setName(String name) {
    this.name = (name == null ? "" : name);
  }

  @Override
  public Declaration getDeclaration() {
    return declaration;
  }
  @Override
  public void setDeclaration(Declaration declaration) {
    this.declaration = declaration;
  }
  @Override
  public Class<? extends Declaration> getDeclarationType() {
    return Function.class;
  }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    into.put("name", name);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("name")) {
      setName(String.valueOf(value));
      return true;
    }
    return false;
  }
}
