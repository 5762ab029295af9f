package hlsc.ui;

import hlsc.HLSC;
import hlsc.errors.CompileException;
import hlsc.ir.ScopeRegistry;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

public class HLSCCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hlsc - build SSA form, state-transition graphs and pipeline control for a scheduled program", options);
    System.exit(-1);
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
                          .argName("program.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the scheduled program")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (memory latencies, SSA, verification, STG dump)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String inputFileName = "";
    String configFileName = null;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      inputFileName = line.getOptionValue("i");
      if (line.hasOption("c"))
        configFileName = line.getOptionValue("c");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    ///////// check options are not empty /////////
    assert inputFileName != null && !inputFileName.isEmpty() : "No input selected!";

    HLSCConfig cfg = new HLSCConfig();
    if (configFileName != null)
      cfg = readConfig(new File(configFileName));

    ScopeRegistry registry;
    try {
      registry = ProgramReader.read(new File(inputFileName));
    } catch (IOException e) {
      logger.error("Program description {} could not be opened", inputFileName);
      printHelpAndExit(options);
      return;
    } catch (CompileException e) {
      logger.fatal("{}", e.toString());
      System.exit(1);
      return;
    }

    //////////   invoke the back end   //////////
    boolean success = new HLSC(cfg).generate(registry);

    System.exit(success ? 0 : 1);
  }

  // load tool options; unset fields keep their defaults
  static HLSCConfig readConfig(File configFile) {
    Yaml yamlConfig = new Yaml(new Constructor(HLSCConfig.class, new LoaderOptions()));
    try (InputStream readFile = new FileInputStream(configFile)) {
      HLSCConfig cfg = yamlConfig.load(readFile);
      if (cfg == null)
        return new HLSCConfig();
      logger.debug("mem_load_latency {}, mem_store_latency {}, build_ssa {}, verify_stg {}", cfg.mem_load_latency,
                   cfg.mem_store_latency, cfg.build_ssa, cfg.verify_stg);
      return cfg;
    } catch (IOException e) {
      logger.error("Config file {} could not be opened", configFile);
      printHelpAndExit(options);
      return null;
    }
  }
}
