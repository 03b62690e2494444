package work.lcod.ui.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.ui.api.CompileResult;
import work.lcod.ui.api.UiCompiler;
import work.lcod.ui.ast.Program;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.io.AstMapper;
import work.lcod.ui.io.ProgramReader;
import work.lcod.ui.io.ProgramWriter;

@CommandLine.Command(
    name = "compile",
    description = "Compile a page (optionally composed with its layout) or a layout to JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class CompileCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private CompilerOptions options = new CompilerOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Program or layout file (.json, .yaml).")
    private Path input;

    @CommandLine.Option(names = "--layout", description = "Layout file to compose the page with.")
    private Path layout;

    @CommandLine.Option(
        names = "--layout-dir",
        description = "Directory holding layouts named by page routes (<name>.json|.yaml|.yml)."
    )
    private Path layoutDirectory;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (default: stdout).")
    private Path output;

    @Override
    public Integer call() {
        var builder = options.builder(input);
        if (layoutDirectory != null) {
            builder.layoutDirectory(layoutDirectory);
        }
        var compiler = CompilerOptions.compiler(builder.build());
        var tree = ProgramReader.readTree(input);

        if (AstMapper.isLayout(tree)) {
            var result = compiler.compileLayout(AstMapper.layout(tree));
            if (!result.isSuccess()) {
                return fail(result);
            }
            return emit(ProgramWriter.toJson(result.output()));
        }

        var result = compilePage(compiler, AstMapper.program(tree));
        if (!result.isSuccess()) {
            return fail(result);
        }
        return emit(ProgramWriter.toJson(result.output()));
    }

    private CompileResult<CompiledProgram> compilePage(UiCompiler compiler, Program page) {
        if (layout != null) {
            var layoutResult = compiler.compileLayout(ProgramReader.readLayout(layout));
            if (!layoutResult.isSuccess()) {
                return CompileResult.failure(layoutResult.errors());
            }
            var pageResult = compiler.compile(page);
            if (!pageResult.isSuccess()) {
                return pageResult;
            }
            return CompileResult.success(compiler.compose(layoutResult.output(), pageResult.output()));
        }
        if (compiler.configuration().layoutDirectory().isPresent()) {
            return compiler.compilePage(page, compiler.layoutRegistry());
        }
        return compiler.compile(page);
    }

    private int emit(String json) {
        if (output != null) {
            ProgramWriter.write(output, json);
        } else {
            spec.commandLine().getOut().println(json);
            spec.commandLine().getOut().flush();
        }
        return CompileResult.Status.SUCCESS.exitCode();
    }

    private int fail(CompileResult<?> result) {
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }
}
