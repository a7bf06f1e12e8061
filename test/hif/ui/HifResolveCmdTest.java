package hif.ui;

import hif.model.FunctionCall;
import hif.model.Node;
import hif.model.ParameterAssign;
import hif.util.TreeWalker;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HifResolveCmdTest {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  private static String design(String name) throws URISyntaxException {
    return HifYamlTest.resource("/designs/" + name).getPath();
  }

  private static List<String> argumentNames(FunctionCall call) {
    List<String> ret = new ArrayList<>();
    for (ParameterAssign pa : call.parameterAssigns)
      ret.add(pa.getName());
    return ret;
  }

  @Test
  void testResolveToFile(@TempDir Path dir) throws IOException, URISyntaxException {
    File result = dir.resolve("out.yaml").toFile();
    Assertions.assertEquals(0, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-o", result.getPath()}, out));
    Assertions.assertEquals(0, buffer.size());

    Node root = HifYamlReader.read(result);
    List<FunctionCall> calls = TreeWalker.collect(root, FunctionCall.class);
    Assertions.assertEquals(List.of("a", "b"), argumentNames(calls.get(0)));
    Assertions.assertEquals(1, calls.get(0).templateParameterAssigns.size());
    Assertions.assertEquals(List.of("v", "factor"), argumentNames(calls.get(1)));
  }

  @Test
  void testTextOutput() throws URISyntaxException {
    Assertions.assertEquals(0, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-f", "text"}, out));
    String text = buffer.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(text.contains("max"), text);
    Assertions.assertTrue(text.contains("factor"), text);
  }

  @Test
  void testConfigFile() throws URISyntaxException {
    String config = HifYamlTest.resource("/configs/limited.yaml").getPath();
    // verilog has no max: with unresolved symbols allowed the run still succeeds
    Assertions.assertEquals(0, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-c", config}, out));
    Assertions.assertEquals(0, HifResolveCmd.run(new String[] {"-q", "-i", design("unresolved.yaml"), "-c", config}, out));
  }

  @Test
  void testUnresolvedIsFatal() throws URISyntaxException {
    Assertions.assertEquals(1, HifResolveCmd.run(new String[] {"-q", "-i", design("unresolved.yaml")}, out));
    Assertions.assertEquals(0, buffer.size());
  }

  @Test
  void testUsageErrors() throws URISyntaxException {
    Assertions.assertEquals(2, HifResolveCmd.run(new String[] {"-q"}, out));
    Assertions.assertEquals(2, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-f", "json"}, out));
    Assertions.assertEquals(2, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-s", "vhdl"}, out));
    Assertions.assertEquals(2, HifResolveCmd.run(new String[] {"-q", "-i", "does/not/exist.yaml"}, out));
    Assertions.assertEquals(0, HifResolveCmd.run(new String[] {"-h"}, out));
  }

  @Test
  void testMappingToVerilogRejectsMax() throws URISyntaxException {
    // max is a hif standard symbol, verilog has no equivalent
    Assertions.assertEquals(1, HifResolveCmd.run(new String[] {"-q", "-i", design("max_call.yaml"), "-m", "hif", "-s", "verilog"}, out));
  }
}
