package hif.model;

/** A node that carries a name. */
public interface NamedNode {
  String getName();
  void setName(String name);
}
