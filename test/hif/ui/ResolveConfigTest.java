package hif.ui;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResolveConfigTest {

  @Test
  void testLoad() throws IOException, URISyntaxException {
    ResolveConfig config = ResolveConfig.load(HifYamlTest.resource("/configs/limited.yaml"));
    Assertions.assertEquals("verilog", config.semantics);
    Assertions.assertEquals("limited", config.missing_arguments);
    Assertions.assertFalse(config.unresolved_fatal);
    Assertions.assertFalse(config.set_missing_names);
    Assertions.assertFalse(config.check_deduction_consistency);
  }

  @Test
  void testDefaults(@TempDir Path dir) throws IOException {
    File partial = dir.resolve("partial.yaml").toFile();
    Files.writeString(partial.toPath(), "semantics: verilog\n");
    ResolveConfig config = ResolveConfig.load(partial);
    Assertions.assertEquals("verilog", config.semantics);
    Assertions.assertEquals("", config.missing_arguments);
    Assertions.assertTrue(config.unresolved_fatal);

    File empty = dir.resolve("empty.yaml").toFile();
    Files.writeString(empty.toPath(), "");
    Assertions.assertEquals("hif", ResolveConfig.load(empty).semantics);
  }

  @Test
  void testUnknownKey(@TempDir Path dir) throws IOException {
    File bad = dir.resolve("bad.yaml").toFile();
    Files.writeString(bad.toPath(), "no_such_option: 1\n");
    Assertions.assertThrows(RuntimeException.class, () -> ResolveConfig.load(bad));
  }
}
