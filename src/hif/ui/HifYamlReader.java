package hif.ui;

import hif.model.CodeInfo;
import hif.model.Node;
import hif.model.NodeKind;
import hif.model.NodeList;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Builds a tree from its YAML form.
 * <p>
 * Every node is a mapping with a {@code kind} key holding the serialized node kind. Scalar entries
 * are attributes, mapping entries fill the slot of the same name and sequence entries the owned
 * list of the same name. An optional {@code codeInfo} mapping holds {@code file}, {@code line}
 * and {@code column}. Declaration bindings are not part of the format.
 * </p>
 */
public class HifYamlReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private HifYamlReader() {}

  public static Node read(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      logger.debug("Reading design {}", file);
      return read(in);
    }
  }

  /**
   * @throws IllegalArgumentException if the document is not a well-formed tree
   */
  public static Node read(InputStream in) {
    Object doc = new Yaml(new LoaderOptions()).load(in);
    if (!(doc instanceof Map))
      throw new IllegalArgumentException("Design document must be a mapping");
    return build((Map<?, ?>)doc, "<root>");
  }

  private static Node build(Map<?, ?> map, String where) {
    Object kindName = map.get("kind");
    if (kindName == null)
      throw new IllegalArgumentException("Missing 'kind' at " + where);
    Node node = NodeKind.fromSerialName(kindName.toString()).create();
    String here = where + "/" + kindName;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String key = entry.getKey().toString();
      Object value = entry.getValue();
      if (key.equals("kind") || value == null)
        continue;
      if (key.equals("codeInfo")) {
        node.setCodeInfo(readCodeInfo(value, here));
      } else if (value instanceof Map) {
        int slot = node.getSlotIndex(key);
        if (slot < 0)
          throw new IllegalArgumentException(node.getKind().serialName + " has no slot '" + key + "' at " + here);
        node.setSlot(slot, build((Map<?, ?>)value, here + "." + key));
      } else if (value instanceof List) {
        NodeList<? extends Node> list = node.getList(key);
        if (list == null)
          throw new IllegalArgumentException(node.getKind().serialName + " has no list '" + key + "' at " + here);
        int index = 0;
        for (Object element : (List<?>)value) {
          if (!(element instanceof Map))
            throw new IllegalArgumentException("Element " + index + " of '" + key + "' is not a node at " + here);
          list.addNode(build((Map<?, ?>)element, here + "." + key + "[" + index + "]"));
          ++index;
        }
      } else if (!node.setAttribute(key, value)) {
        throw new IllegalArgumentException(node.getKind().serialName + " has no attribute '" + key + "' at " + here);
      }
    }
    return node;
  }

  private static CodeInfo readCodeInfo(Object value, String where) {
    if (!(value instanceof Map))
      throw new IllegalArgumentException("codeInfo must be a mapping at " + where);
    Map<?, ?> map = (Map<?, ?>)value;
    Object file = map.get("file");
    Object line = map.get("line");
    Object column = map.get("column");
    return new CodeInfo(file == null ? "" : file.toString(), line == null ? 0 : Integer.parseInt(line.toString()),
                        column == null ? 0 : Integer.parseInt(column.toString()));
  }
}
