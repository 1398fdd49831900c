package org.sedfuse.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.sedfuse.application.output.OutputTemplate;
import org.sedfuse.application.parse.InputGrammar;
import org.sedfuse.config.ConfigMerger;
import org.sedfuse.config.DefaultsForMode;
import org.sedfuse.config.FuseConfig;
import org.sedfuse.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates an output template against an input grammar and lists the fields it renders.
 *
 * @since 0.1.0
 */
public final class TemplateCli {
  private static final Logger log = LoggerFactory.getLogger(TemplateCli.class);
  private static final String MODE = "template";
  private static final String SUMMARY_USAGE =
      "usage: template [template=TEXT] [fields=a,b,...] [field.NAME.pattern=REGEX] [config=YAML]";
  private static final String HELP_TEXT = """
      sedfuse template: validate an output template

      Usage:
        template template='{name} {freq:%.3e} {flux:%.3e}' [options]

      Optional:
        template=TEXT              Template to check (default: the built-in result line)
        fields=a,b,...             Input fields; extras may appear in the template
        field.NAME.pattern=REGEX   Override the pattern of one input field
        config=PATH                YAML file with common/template sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private TemplateCli() {}

  /**
   * Runs the template command.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS} when the template is valid, {@link ExitCode#CONFIG_ERROR} otherwise
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> unsupported = input.unsupportedFlags(Set.of());
    if (!unsupported.isEmpty()) {
      log.error("Unsupported flags: {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Optional<Map<String, String>> yaml = ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), MODE);
      effective = ConfigMerger.buildEffectiveConfig(MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid template arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    InputGrammar grammar;
    OutputTemplate template;
    try {
      grammar = InputGrammar.of(FuseConfig.fieldsOf(effective), FuseConfig.fieldPatternsOf(effective));
      template = OutputTemplate.compile(effective.get("template"), grammar.extraFieldNames());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid template: {}", ex.getMessage());
      CliPrinter.println("Template invalid: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    CliPrinter.printLines(
        "Template valid.",
        " Template      : " + template.source(),
        " Output fields : " + String.join(" ", template.fieldNames()),
        " Input fields  : " + String.join(" ", grammar.fieldNames()),
        " Extra fields  : " + (grammar.extraFieldNames().isEmpty()
            ? "<none>" : String.join(" ", grammar.extraFieldNames())));
    return ExitCode.SUCCESS;
  }
}
