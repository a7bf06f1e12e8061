package hif.semantics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Lookup of dialect policies by name. Every call creates a fresh semantics value.
 */
public class SemanticsRegistry {
  private static final Map<String, Supplier<LanguageSemantics>> factories = new LinkedHashMap<>();
  static {
    factories.put(HifSemantics.NAME, HifSemantics::new);
    factories.put(VerilogSemantics.NAME, VerilogSemantics::new);
  }

  private SemanticsRegistry() {}

  public static LanguageSemantics create(String name) {
    Supplier<LanguageSemantics> factory = factories.get(name);
    if (factory == null)
      throw new IllegalArgumentException("Unknown semantics '" + name + "', known: " + factories.keySet());
    return factory.get();
  }

  public static Set<String> getNames() {
    return factories.keySet();
  }
}
