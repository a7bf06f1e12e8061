package hif.model;

/**
 * Common view of function and procedure calls.
 * The optional instance is the object a method is called on.
 */
public interface Call extends Symbol {
  Value getInstance();
  Value setInstance(Value instance);
  NodeList<TPAssign> getTemplateParameterAssigns();
  NodeList<ParameterAssign> getParameterAssigns();
}
