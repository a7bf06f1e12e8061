package hif.ui;

import hif.diag.HifException;
import hif.manipulation.ExplicitCallsParameters;
import hif.manipulation.MapStandardSymbols;
import hif.manipulation.SortMissingKind;
import hif.model.Library;
import hif.model.Node;
import hif.model.ReferencedAssign;
import hif.model.Symbol;
import hif.semantics.LanguageSemantics;
import hif.semantics.SemanticsRegistry;
import hif.semantics.UpdateDeclarationOptions;
import hif.semantics.UpdateDeclarations;
import hif.util.NodePrinter;
import hif.util.TreeWalker;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HifResolveCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("hifresolve - resolve declarations and make call arguments explicit in a HIF design", options);
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML file holding the design tree")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("semantics")
                          .argName("name")
                          .hasArg()
                          .required(false)
                          .desc("Language semantics of the design. Must be one of: " + SemanticsRegistry.getNames())
                          .build());
    options.addOption(Option.builder("m")
                          .longOpt("map-from")
                          .argName("name")
                          .hasArg()
                          .required(false)
                          .desc("Semantics the design is written in; standard symbols are mapped to the target semantics")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the resulting tree to; standard output by default")
                          .build());
    options.addOption(Option.builder("f")
                          .longOpt("format")
                          .argName("yaml|text")
                          .hasArg()
                          .required(false)
                          .desc("Output format, yaml by default")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the resulting tree
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args, System.out));
  }

  /**
   * Runs the tool.
   * @param out destination of the resulting tree when no output file is given
   * @return the process exit code
   */
  public static int run(String[] args, PrintStream out) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    // help does not need the required options
    for (String arg : args) {
      if (arg.equals("-h") || arg.equals("--help")) {
        printHelp(options);
        return 0;
      }
    }
    CommandLine line;
    try {
      // parse the command line arguments
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 2;
    }
    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    ResolveConfig config = new ResolveConfig();
    try {
      if (line.hasOption("c"))
        config = ResolveConfig.load(new File(line.getOptionValue("c")));
    } catch (IOException | RuntimeException e) {
      logger.error("Config file {} could not be read: {}", line.getOptionValue("c"), e.getMessage());
      return 2;
    }
    if (line.hasOption("s"))
      config.semantics = line.getOptionValue("s");
    String format = line.getOptionValue("f", "yaml");
    if (!format.equals("yaml") && !format.equals("text")) {
      logger.error("Unknown output format '{}'", format);
      return 2;
    }

    Node root;
    LanguageSemantics sem;
    LanguageSemantics srcSem = null;
    ExplicitCallsParameters.Options passOpt = new ExplicitCallsParameters.Options();
    try {
      sem = SemanticsRegistry.create(config.semantics);
      if (line.hasOption("m"))
        srcSem = SemanticsRegistry.create(line.getOptionValue("m"));
      if (config.missing_arguments != null && !config.missing_arguments.isEmpty())
        passOpt.missing = SortMissingKind.fromSerialName(config.missing_arguments);
      root = HifYamlReader.read(new File(line.getOptionValue("i")));
    } catch (IOException | IllegalArgumentException e) {
      logger.error("Cannot start: {}", e.getMessage());
      return 2;
    }
    passOpt.setNames = config.set_missing_names;
    passOpt.error = config.unresolved_fatal;
    sem.setDeductionConsistencyChecked(config.check_deduction_consistency);

    //////////   resolve and rewrite   //////////
    try {
      if (srcSem != null) {
        UpdateDeclarations.update(root, srcSem);
        MapStandardSymbols.run(root, srcSem, sem);
      }
      UpdateDeclarationOptions updateOpt = new UpdateDeclarationOptions();
      updateOpt.error = config.unresolved_fatal;
      UpdateDeclarations.update(root, sem, updateOpt);
      int sorted = ExplicitCallsParameters.run(root, sem, passOpt);
      logger.info("Made {} argument lists explicit", sorted);
      reportUnresolved(root);
    } catch (HifException e) {
      logger.error(e.getMessage());
      return 1;
    }

    String result = format.equals("yaml") ? HifYamlWriter.write(root) : new NodePrinter(true).print(root);
    if (line.hasOption("o")) {
      try {
        Files.writeString(new File(line.getOptionValue("o")).toPath(), result, StandardCharsets.UTF_8);
      } catch (IOException e) {
        logger.error("Output file {} could not be written: {}", line.getOptionValue("o"), e.getMessage());
        return 2;
      }
    } else {
      out.print(result);
    }
    return 0;
  }

  private static void reportUnresolved(Node root) {
    int unresolved = 0;
    for (Symbol sym : TreeWalker.collect(root, Symbol.class)) {
      if (sym.getDeclaration() != null || sym instanceof ReferencedAssign)
        continue;
      if (sym instanceof Library && ((Library)sym).isSystem())
        continue;
      logger.warn("Unresolved symbol {}", sym);
      ++unresolved;
    }
    if (unresolved > 0)
      logger.warn("{} symbols remain unresolved", unresolved);
  }
}
