package stepnet.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import stepnet.StepNet;
import stepnet.config.RulesFormatException;
import stepnet.config.RulesLoader;
import stepnet.config.SyntaxRules;
import stepnet.config.ValidationRules;
import stepnet.drc.ProgramRegistry;
import stepnet.frontend.Diagnostic;
import stepnet.frontend.ParseResult;
import stepnet.frontend.Program;
import stepnet.frontend.SourceKind;
import stepnet.frontend.StepProgramParser;
import stepnet.netlist.GenerationException;

public class StepNetCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options, int status) {
    helper.printHelp("stepnetcmd - compile RUST/STAP step programs into FBD netlist XML", options);
    System.exit(status);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("program file")
                          .hasArg()
                          .required(true)
                          .desc("Step program text file; may be given several times, earlier programs resolve cross-references of later ones")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files; results by default")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("source")
                          .argName("kind")
                          .hasArg()
                          .required(false)
                          .desc("How the text was obtained: document-import or direct-entry (default)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("StepNetConfig.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options")
                          .build());
    options.addOption(
        Option.builder().longOpt("syntax").argName("syntax.yaml").hasArg().required(false).desc("YAML-file with keyword configuration").build());
    options.addOption(
        Option.builder().longOpt("rules").argName("rules.yaml").hasArg().required(false).desc("YAML-file with validation rules").build());
    options.addOption(Option.builder().longOpt("strict").required(false).desc("Report unresolved cross-references as errors").build());
    options.addOption(Option.builder().longOpt("compact").required(false).desc("Write XML without indentation").build());
    options.addOption(
        Option.builder().longOpt("allow-errors").required(false).desc("Export programs even if they have structural errors").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    // help must not fail on the required input option
    for (String arg : args) {
      if (arg.equals("-h") || arg.equals("--help"))
        printHelpAndExit(options, 0);
    }

    //////////   collect options   //////////
    String[] inputFiles = new String[0];
    String outputDir = "results";
    SourceKind source = SourceKind.DirectEntry;
    boolean allowErrors = false;
    StepNetConfig cfg = new StepNetConfig();
    SyntaxRules syntax = SyntaxRules.defaults();
    ValidationRules rules = ValidationRules.defaults();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      inputFiles = line.getOptionValues("i");
      if (line.hasOption("o"))
        outputDir = line.getOptionValue("o");
      if (line.hasOption("s")) {
        var opt_source = SourceKind.fromSerialName(line.getOptionValue("s"));
        if (opt_source.isEmpty()) {
          System.err.println("Unknown source kind " + line.getOptionValue("s"));
          printHelpAndExit(options, 1);
        }
        source = opt_source.get();
      }
      if (line.hasOption("c"))
        cfg = loadConfig(new File(line.getOptionValue("c")));
      RulesLoader loader = new RulesLoader();
      if (line.hasOption("syntax"))
        syntax = loader.loadSyntax(new File(line.getOptionValue("syntax")));
      if (line.hasOption("rules"))
        rules = loader.loadValidation(new File(line.getOptionValue("rules")));
      if (line.hasOption("strict"))
        cfg.strictCrossReferences = true;
      if (line.hasOption("compact"))
        cfg.pretty = false;
      allowErrors = line.hasOption("allow-errors");
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options, 1);
    } catch (RulesFormatException e) {
      logger.error("Invalid configuration: {}", e.getMessage());
      System.exit(1);
    }

    //////////   parse, validate and export each program   //////////
    StepNet stepNet = new StepNet(syntax, rules, cfg);
    ProgramRegistry registry = ProgramRegistry.empty();
    boolean success = true;
    for (String inputFile : inputFiles) {
      Path inputPath = Path.of(inputFile);
      String text;
      try {
        text = Files.readString(inputPath, StandardCharsets.UTF_8);
      } catch (IOException e) {
        logger.error("Program file {} could not be read: {}", inputFile, e.getMessage());
        success = false;
        continue;
      }
      logger.info("Read {}", inputFile);

      Map<String, String> metadata = new HashMap<>();
      metadata.put(StepProgramParser.META_PROGRAM_NAME, baseName(inputPath));
      ParseResult result = stepNet.parse(text, source, metadata, registry);
      Program program = result.getProgram();
      printDiagnostics(inputFile, result);
      if (!program.getName().isEmpty())
        registry = registry.with(program);

      if (result.hasErrors() && !allowErrors) {
        logger.error("{} has {} structural errors, not exported", inputFile, result.getErrors().size());
        success = false;
        continue;
      }
      try {
        String xml = stepNet.generate(program);
        String name = program.getName().isEmpty() ? baseName(inputPath) : program.getName();
        Path outputPath = Path.of(outputDir, fileName(name) + ".xml");
        Files.createDirectories(outputPath.getParent());
        Files.writeString(outputPath, xml, StandardCharsets.UTF_8);
        logger.info("Wrote {}", outputPath);
      } catch (GenerationException e) {
        logger.error("{}: {}", inputFile, e.getMessage());
        success = false;
      } catch (IOException e) {
        logger.error("Output for {} could not be written: {}", inputFile, e.getMessage());
        success = false;
      }
    }
    System.exit(success ? 0 : 1);
  }

  /**
   * Reads tool options from YAML; keys that are not given keep their default.
   * @param file the YAML file
   * @return the options
   */
  static StepNetConfig loadConfig(File file) {
    Yaml yaml = new Yaml(new Constructor(StepNetConfig.class, new LoaderOptions()));
    try (InputStream in = new FileInputStream(file)) {
      StepNetConfig cfg = yaml.load(in);
      return cfg == null ? new StepNetConfig() : cfg;
    } catch (IOException e) {
      throw new RulesFormatException("", "cannot read config file " + file, e);
    } catch (YAMLException e) {
      throw new RulesFormatException("", "malformed config file " + file + ": " + e.getMessage(), e);
    }
  }

  private static void printDiagnostics(String inputFile, ParseResult result) {
    for (Diagnostic error : result.getErrors())
      logger.error("{}: {}", inputFile, error);
    for (Diagnostic warning : result.getWarnings())
      logger.warn("{}: {}", inputFile, warning);
    logger.debug("{}: complexity {}", inputFile, result.getStatistics().complexityScore);
  }

  private static String baseName(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  static String fileName(String programName) { return programName.replaceAll("[^\\p{L}\\p{N}_.-]+", "_"); }
}
