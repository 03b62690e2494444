package work.lcod.ui.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.ui.analysis.SemanticAnalyzer;
import work.lcod.ui.compose.UnmatchedSlotPolicy;

/**
 * Immutable settings for a {@link UiCompiler}.
 */
public record CompilerConfiguration(
    int maxDepth,
    UnmatchedSlotPolicy unmatchedSlotPolicy,
    Optional<Path> layoutDirectory,
    LogLevel logLevel
) {
    public CompilerConfiguration {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        Objects.requireNonNull(unmatchedSlotPolicy, "unmatchedSlotPolicy");
        Objects.requireNonNull(layoutDirectory, "layoutDirectory");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static CompilerConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxDepth(maxDepth)
            .unmatchedSlotPolicy(unmatchedSlotPolicy)
            .layoutDirectory(layoutDirectory.orElse(null))
            .logLevel(logLevel);
    }

    public static final class Builder {
        private int maxDepth = SemanticAnalyzer.DEFAULT_MAX_DEPTH;
        private UnmatchedSlotPolicy unmatchedSlotPolicy = UnmatchedSlotPolicy.EMPTY;
        private Path layoutDirectory;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder unmatchedSlotPolicy(UnmatchedSlotPolicy unmatchedSlotPolicy) {
            this.unmatchedSlotPolicy = unmatchedSlotPolicy;
            return this;
        }

        public Builder layoutDirectory(Path layoutDirectory) {
            this.layoutDirectory = layoutDirectory;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CompilerConfiguration build() {
            return new CompilerConfiguration(maxDepth, unmatchedSlotPolicy, Optional.ofNullable(layoutDirectory), logLevel);
        }
    }
}
