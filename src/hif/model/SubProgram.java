package hif.model;

import java.util.Map;

/** Functions and procedures. Generic parameters are ValueTP or TypeTP declarations. */
public abstract class SubProgram extends Declaration implements Scope {
  public final NodeList<Declaration> templateParameters = addList("templateParameters", Declaration.class);
  public final NodeList<Parameter> parameters = addList("parameters", Parameter.class);

  private SubProgramKind subProgramKind = SubProgramKind.STATIC;

  protected SubProgram(String... slotNames) { super(slotNames); }

  @Override
  public NodeList<Declaration> getTemplateParameters() {
    return templateParameters;
  }

  public abstract StateTable getStateTable();
  public abstract StateTable setStateTable(StateTable body);

  public SubProgramKind getSubProgramKind() { return subProgramKind; }
  public void setSubProgramKind(SubProgramKind kind) { this.subProgramKind = kind; }

  @Override
  protected void collectAttributes(Map<String, Object> into) {
    super.collectAttributes(into);
    into.put("subProgramKind", subProgramKind.serialName);
  }
  @Override
  public boolean setAttribute(String key, Object value) {
    if (key.equals("subProgramKind")) {
      subProgramKind = SubProgramKind.fromSerialName(String.valueOf(value));
      return true;
    }
    return super.setAttribute(key, value);
  }
}
