package hif.diag;

import hif.model.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects recoverable problems found during one pass, so that all of them are reported together.
 */
public class DiagnosticBatch {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public record Entry(String message, Node node) {
    @Override
    public String toString() {
      return message + (node != null ? " (" + node + ")" : "");
    }
  }

  private final String passName;
  private final String semanticsName;
  private final List<Entry> entries = new ArrayList<>();

  public DiagnosticBatch(String passName, String semanticsName) {
    this.passName = passName;
    this.semanticsName = semanticsName;
  }

  public void add(String message, Node node) {
    entries.add(new Entry(message, node));
  }

  public boolean isEmpty() { return entries.isEmpty(); }
  public List<Entry> getEntries() { return Collections.unmodifiableList(entries); }

  /**
   * Logs every collected entry and fails with a single summary diagnostic if there is any.
   */
  public void reportAndThrow() {
    if (entries.isEmpty())
      return;
    for (Entry entry : entries)
      logger.warn("{}: {}", passName, entry);
    String summary = passName + " found " + entries.size() + " problem" + (entries.size() == 1 ? "" : "s") + ": "
        + entries.get(0) + (entries.size() > 1 ? " (and " + (entries.size() - 1) + " more)" : "");
    logger.error(summary);
    throw new HifException(summary, entries.get(0).node(), semanticsName);
  }
}
