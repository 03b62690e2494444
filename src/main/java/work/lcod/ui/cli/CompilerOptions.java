package work.lcod.ui.cli;

import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine;
import work.lcod.ui.api.CompilerConfiguration;
import work.lcod.ui.api.LogLevel;
import work.lcod.ui.api.UiCompiler;
import work.lcod.ui.compose.UnmatchedSlotPolicy;
import work.lcod.ui.config.ConfigurationLoader;

/**
 * Options shared by the subcommands. Command-line values override {@code uic.toml}.
 */
final class CompilerOptions {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (default: uic.toml next to the input, when present)."
    )
    Path config;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum view nesting depth before lowering degrades to a placeholder."
    )
    Integer maxDepth;

    @CommandLine.Option(
        names = "--unmatched-slots",
        paramLabel = "empty|keep",
        description = "What composition does with named slots that receive no content."
    )
    String unmatchedSlots;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error)."
    )
    String logLevel;

    CompilerConfiguration.Builder builder(Path input) {
        var configFile = config != null ? Optional.of(config) : ConfigurationLoader.locate(input);
        var builder = configFile.map(ConfigurationLoader::load).orElseGet(CompilerConfiguration::builder);
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (unmatchedSlots != null) {
            builder.unmatchedSlotPolicy(UnmatchedSlotPolicy.from(unmatchedSlots));
        }
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        return builder;
    }

    /** Applies the log level before the first logger is created, then builds the compiler. */
    static UiCompiler compiler(CompilerConfiguration configuration) {
        if (System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
            System.setProperty(SIMPLE_LOGGER_LEVEL, configuration.logLevel().simpleLoggerName());
        }
        return new UiCompiler(configuration);
    }
}
