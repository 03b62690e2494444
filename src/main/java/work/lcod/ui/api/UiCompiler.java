package work.lcod.ui.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.analysis.AnalysisContext;
import work.lcod.ui.analysis.LayoutAnalysisContext;
import work.lcod.ui.analysis.LayoutAnalyzer;
import work.lcod.ui.analysis.SemanticAnalyzer;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.Program;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.compose.LayoutComposer;
import work.lcod.ui.compose.LayoutRegistry;
import work.lcod.ui.io.ProgramReader;
import work.lcod.ui.lowering.ProgramLowerer;

/**
 * Public entry point: analyze, then lower, then optionally compose with a layout.
 *
 * <p>Lowering only runs on programs that analyzed cleanly. Instances hold no per-call state and can be shared.</p>
 */
public final class UiCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(UiCompiler.class);
    private static final List<String> LAYOUT_EXTENSIONS = List.of(".json", ".yaml", ".yml");

    private final CompilerConfiguration configuration;
    private final SemanticAnalyzer analyzer;
    private final LayoutAnalyzer layoutAnalyzer;
    private final ProgramLowerer lowerer;
    private final LayoutComposer composer;

    public UiCompiler() {
        this(CompilerConfiguration.defaults());
    }

    public UiCompiler(CompilerConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.analyzer = new SemanticAnalyzer(configuration.maxDepth());
        this.layoutAnalyzer = new LayoutAnalyzer(configuration.maxDepth());
        this.lowerer = new ProgramLowerer(configuration.maxDepth());
        this.composer = new LayoutComposer(lowerer, configuration.unmatchedSlotPolicy());
    }

    public CompilerConfiguration configuration() {
        return configuration;
    }

    public CompileResult<AnalysisContext> analyze(Program program) {
        var result = analyzer.analyze(program);
        return result.isSuccess() ? CompileResult.success(result.context()) : CompileResult.failure(result.errors());
    }

    public CompileResult<LayoutAnalysisContext> analyzeLayout(LayoutProgram layout) {
        var result = layoutAnalyzer.analyze(layout);
        return result.isSuccess() ? CompileResult.success(result.context()) : CompileResult.failure(result.errors());
    }

    public CompileResult<CompiledProgram> compile(Program program) {
        var started = Instant.now();
        var analysis = analyzer.analyze(program);
        if (!analysis.isSuccess()) {
            LOG.debug("Program rejected with {} error(s)", analysis.errors().size());
            return CompileResult.failure(analysis.errors());
        }
        var compiled = lowerer.lowerPage(program);
        LOG.debug("Program compiled in {} ms", Duration.between(started, Instant.now()).toMillis());
        return CompileResult.success(compiled);
    }

    public CompileResult<CompiledLayoutProgram> compileLayout(LayoutProgram layout) {
        var started = Instant.now();
        var analysis = layoutAnalyzer.analyze(layout);
        if (!analysis.isSuccess()) {
            LOG.debug("Layout rejected with {} error(s)", analysis.errors().size());
            return CompileResult.failure(analysis.errors());
        }
        var compiled = lowerer.lowerLayout(layout);
        LOG.debug("Layout compiled in {} ms", Duration.between(started, Instant.now()).toMillis());
        return CompileResult.success(compiled);
    }

    /**
     * Compiles a page and, when its route names a layout, composes it with the layout resolved from the registry.
     *
     * @throws work.lcod.ui.compose.LayoutNotFoundException when the route names a layout the registry cannot provide
     */
    public CompileResult<CompiledProgram> compilePage(Program page, LayoutRegistry layouts) {
        var result = compile(page);
        if (!result.isSuccess()) {
            return result;
        }
        var compiled = result.output();
        if (compiled.route() == null || compiled.route().layout() == null) {
            return result;
        }
        var layout = layouts.resolve(compiled.route().layout());
        return CompileResult.success(compose(layout, compiled));
    }

    public CompiledProgram compose(CompiledLayoutProgram layout, CompiledProgram page) {
        var started = Instant.now();
        var composed = composer.compose(layout, page);
        LOG.debug("Layout composed in {} ms", Duration.between(started, Instant.now()).toMillis());
        return composed;
    }

    /**
     * A registry backed by the configured layout directory, or an empty one when none is configured.
     * Layout {@code name} is read from {@code <dir>/<name>.json}, {@code .yaml} or {@code .yml}.
     */
    public LayoutRegistry layoutRegistry() {
        return configuration.layoutDirectory()
            .map(dir -> new LayoutRegistry(name -> loadLayout(dir, name)))
            .orElseGet(LayoutRegistry::new);
    }

    private CompiledLayoutProgram loadLayout(Path directory, String name) {
        for (var extension : LAYOUT_EXTENSIONS) {
            var candidate = directory.resolve(name + extension);
            if (Files.isRegularFile(candidate)) {
                var result = compileLayout(ProgramReader.readLayout(candidate));
                if (!result.isSuccess()) {
                    throw new IllegalStateException(
                        "Layout '" + name + "' is invalid: " + result.errors().get(0) + " (" + candidate + ")"
                    );
                }
                return result.output();
            }
        }
        return null;
    }
}
