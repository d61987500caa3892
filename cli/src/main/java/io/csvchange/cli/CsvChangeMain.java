package io.csvchange.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.csvchange.config.PipelineConfig;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Command-line entry point. Settings come from {@code csvchange.*} system properties or {@code CSVCHANGE_*}
 * environment variables.
 */
@CommandLine.Command(
        name = "csv-change",
        mixinStandardHelpOptions = true,
        version = "csv-change 0.1.0",
        description = "Watch, back up, validate and diff CSV data files",
        subcommands = {
                WatchCommand.class,
                ValidateCommand.class,
                BackupCommand.class,
                DiffCommand.class,
                LogCommand.class,
                CommandLine.HelpCommand.class
        })
public final class CsvChangeMain implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = commandLine(PipelineConfig.fromEnv()).execute(args);
        System.exit(code);
    }

    static CommandLine commandLine(PipelineConfig config) {
        Injector injector = Guice.createInjector(new CsvChangeModule(config));
        return new CommandLine(CsvChangeMain.class, new GuiceFactory(injector));
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
