package hif.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class ResolveConfig {

  public String semantics = "hif";
  /** none, limited or all; empty uses the policy of the semantics. */
  public String missing_arguments = "";
  public boolean unresolved_fatal = true;
  public boolean set_missing_names = true;
  public boolean check_deduction_consistency = true;

  /**
   * Reads a config from a YAML file; keys absent from the file keep their defaults.
   */
  public static ResolveConfig load(File file) throws IOException {
    Yaml yaml = new Yaml(new Constructor(ResolveConfig.class, new LoaderOptions()));
    try (InputStream in = new FileInputStream(file)) {
      ResolveConfig ret = yaml.load(in);
      return ret != null ? ret : new ResolveConfig();
    }
  }
}
