package work.lcod.ui.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "uic",
    description = "Validate and compile declarative UI programs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { ValidateCommand.class, CompileCommand.class }
)
final class UicCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: validate or compile.");
    }
}
