package hif.ui;

import hif.model.CodeInfo;
import hif.model.Node;
import hif.model.NodeList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/** Writes a tree in the form read by {@link HifYamlReader}. */
public class HifYamlWriter {
  private HifYamlWriter() {}

  public static String write(Node root) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    return new Yaml(options).dump(toMap(root));
  }

  static Map<String, Object> toMap(Node node) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("kind", node.getKind().serialName);
    ret.putAll(node.getAttributes());
    CodeInfo ci = node.getCodeInfo();
    if (ci != null) {
      Map<String, Object> pos = new LinkedHashMap<>();
      pos.put("file", ci.getFileName());
      pos.put("line", ci.getLine());
      pos.put("column", ci.getColumn());
      ret.put("codeInfo", pos);
    }
    for (int i = 0; i < node.getSlotCount(); ++i)
      if (node.getSlot(i) != null)
        ret.put(node.getSlotName(i), toMap(node.getSlot(i)));
    for (NodeList<? extends Node> list : node.getLists()) {
      if (list.isEmpty())
        continue;
      List<Object> elements = new ArrayList<>();
      for (Node element : list)
        elements.add(toMap(element));
      ret.put(list.getName(), elements);
    }
    return ret;
  }
}
