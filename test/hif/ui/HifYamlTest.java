package hif.ui;

import hif.compare.Equals;
import hif.model.Assign;
import hif.model.FunctionCall;
import hif.model.Int;
import hif.model.Node;
import hif.model.SystemRoot;
import hif.model.Variable;
import hif.util.TreeWalker;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HifYamlTest {

  static File resource(String path) throws URISyntaxException {
    return new File(HifYamlTest.class.getResource(path).toURI());
  }

  private static Node parse(String text) {
    return HifYamlReader.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testReadDesign() throws IOException, URISyntaxException {
    Node root = HifYamlReader.read(resource("/designs/max_call.yaml"));

    Assertions.assertTrue(root instanceof SystemRoot);
    List<Variable> vars = TreeWalker.collect(root, Variable.class);
    Assertions.assertEquals(1, vars.size());
    Int type = (Int)vars.get(0).getType();
    Assertions.assertTrue(type.isSigned());
    List<FunctionCall> calls = TreeWalker.collect(root, FunctionCall.class);
    Assertions.assertEquals(2, calls.size());
    Assertions.assertEquals("max", calls.get(0).getName());
    Assertions.assertEquals(2, calls.get(0).parameterAssigns.size());
    Assertions.assertFalse(calls.get(0).parameterAssigns.get(0).isNamed());

    Assign first = TreeWalker.collect(root, Assign.class).get(0);
    Assertions.assertEquals("top.hif", first.getCodeInfo().getFileName());
    Assertions.assertEquals(12, first.getCodeInfo().getLine());
  }

  @Test
  void testWriteThenReadKeepsTree() throws IOException, URISyntaxException {
    Node root = HifYamlReader.read(resource("/designs/max_call.yaml"));
    String text = HifYamlWriter.write(root);
    Node again = parse(text);

    Assertions.assertTrue(Equals.equals(root, again));
    Assertions.assertEquals(text, HifYamlWriter.write(again));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "- just a list",
      "name: no kind",
      "kind: Unknown",
      "kind: Identifier\nnoSuchAttribute: 1",
      "kind: Assign\nnoSuchSlot: {kind: IntValue, value: 1}",
      "kind: Contents\nstateTables: [3]"})
  void testMalformedDocuments(String text) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> parse(text));
  }
}
