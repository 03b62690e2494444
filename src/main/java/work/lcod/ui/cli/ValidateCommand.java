package work.lcod.ui.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.ui.api.CompileResult;
import work.lcod.ui.io.AstMapper;
import work.lcod.ui.io.ProgramReader;

@CommandLine.Command(
    name = "validate",
    description = "Run semantic analysis on a page or layout and print the diagnostics.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ValidateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private CompilerOptions options = new CompilerOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Program or layout file (.json, .yaml).")
    private Path input;

    @Override
    public Integer call() {
        var compiler = CompilerOptions.compiler(options.builder(input).build());
        var tree = ProgramReader.readTree(input);
        CompileResult<?> result = AstMapper.isLayout(tree)
            ? compiler.analyzeLayout(AstMapper.layout(tree))
            : compiler.analyze(AstMapper.program(tree));
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }
}
