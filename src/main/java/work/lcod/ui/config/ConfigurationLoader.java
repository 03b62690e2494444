package work.lcod.ui.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.ui.api.CompilerConfiguration;
import work.lcod.ui.api.LogLevel;
import work.lcod.ui.compose.UnmatchedSlotPolicy;

/**
 * Reads compiler settings from a {@code uic.toml} file.
 *
 * <pre>
 * [compiler]
 * max-depth = 256
 * unmatched-slots = "empty"   # or "keep"
 * layout-dir = "layouts"      # relative to the file
 * log-level = "warn"
 * </pre>
 */
public final class ConfigurationLoader {
    public static final String FILE_NAME = "uic.toml";
    static final String SECTION = "compiler";

    private ConfigurationLoader() {}

    /** The {@value #FILE_NAME} sitting next to {@code input}, if any. */
    public static Optional<Path> locate(Path input) {
        var parent = input.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        var candidate = parent.resolve(FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static CompilerConfiguration.Builder load(Path file) {
        TomlParseResult result;
        try {
            result = Toml.parse(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + file, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid configuration " + file + ": " + result.errors().get(0).toString());
        }
        var base = file.toAbsolutePath().getParent();
        return apply(result.getTable(SECTION), base, CompilerConfiguration.builder());
    }

    public static CompilerConfiguration.Builder parse(String toml, Path base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid configuration: " + result.errors().get(0).toString());
        }
        return apply(result.getTable(SECTION), base, CompilerConfiguration.builder());
    }

    private static CompilerConfiguration.Builder apply(TomlTable table, Path base, CompilerConfiguration.Builder builder) {
        if (table == null) {
            return builder;
        }
        Long maxDepth = table.getLong("max-depth");
        if (maxDepth != null) {
            builder.maxDepth(Math.toIntExact(maxDepth));
        }
        String policy = table.getString("unmatched-slots");
        if (policy != null) {
            builder.unmatchedSlotPolicy(UnmatchedSlotPolicy.from(policy));
        }
        String layoutDir = table.getString("layout-dir");
        if (layoutDir != null && !layoutDir.isBlank()) {
            var dir = Path.of(layoutDir);
            builder.layoutDirectory(dir.isAbsolute() || base == null ? dir : base.resolve(dir).normalize());
        }
        String logLevel = table.getString("log-level");
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        return builder;
    }
}
