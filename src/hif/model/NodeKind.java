package hif.model;

import java.util.function.Supplier;

/**
 * Runtime variant tag of a node, with its serialized name and a factory for empty instances.
 */
public enum NodeKind {
  SYSTEM("System", SystemRoot::new),
  LIBRARY_DEF("LibraryDef", LibraryDef::new),
  DESIGN_UNIT("DesignUnit", DesignUnit::new),
  VIEW("View", View::new),
  ENTITY("Entity", Entity::new),
  CONTENTS("Contents", Contents::new),
  STATE_TABLE("StateTable", StateTable::new),
  FUNCTION("Function", Function::new),
  PROCEDURE("Procedure", Procedure::new),
  PARAMETER("Parameter", Parameter::new),
  PORT("Port", Port::new),
  VARIABLE("Variable", Variable::new),
  CONST("Const", Const::new),
  SIGNAL("Signal", Signal::new),
  FIELD("Field", Field::new),
  ENUM_VALUE("EnumValue", EnumValue::new),
  TYPE_DEF("TypeDef", TypeDef::new),
  TYPE_TP("TypeTP", TypeTP::new),
  VALUE_TP("ValueTP", ValueTP::new),
  INSTANCE("Instance", Instance::new),
  LIBRARY("Library", Library::new),
  PARAMETER_ASSIGN("ParameterAssign", ParameterAssign::new),
  PORT_ASSIGN("PortAssign", PortAssign::new),
  VALUE_TP_ASSIGN("ValueTPAssign", ValueTPAssign::new),
  TYPE_TP_ASSIGN("TypeTPAssign", TypeTPAssign::new),
  BIT("Bit", Bit::new),
  BOOL("Bool", Bool::new),
  INT("Int", Int::new),
  BITVECTOR("Bitvector", Bitvector::new),
  ARRAY("Array", Array::new),
  RECORD("Record", RecordType::new),
  ENUM("Enum", EnumType::new),
  TYPE_REFERENCE("TypeReference", TypeReference::new),
  VIEW_REFERENCE("ViewReference", ViewReference::new),
  RANGE("Range", Range::new),
  IDENTIFIER("Identifier", Identifier::new),
  INT_VALUE("IntValue", IntValue::new),
  BOOL_VALUE("BoolValue", BoolValue::new),
  BIT_VALUE("BitValue", BitValue::new),
  EXPRESSION("Expression", Expression::new),
  CAST("Cast", Cast::new),
  FUNCTION_CALL("FunctionCall", FunctionCall::new),
  FIELD_REFERENCE("FieldReference", FieldReference::new),
  MEMBER("Member", Member::new),
  ASSIGN("Assign", Assign::new),
  PROCEDURE_CALL("ProcedureCall", ProcedureCall::new),
  RETURN("Return", Return::new);

  public final String serialName;
  private final Supplier<? extends Node> factory;

  private NodeKind(String serialName, Supplier<? extends Node> factory) {
    this.serialName = serialName;
    this.factory = factory;
  }

  /** Creates an empty node of this kind. */
  public Node create() {
    return factory.get();
  }

  public static NodeKind fromSerialName(String name) {
    for (NodeKind kind : values())
      if (kind.serialName.equals(name) || kind.name().equals(name))
        return kind;
    throw new IllegalArgumentException("Unknown node kind '" + name + "'");
  }
}
