package io.csvchange.cli;

import com.google.inject.Inject;
import io.csvchange.config.PipelineConfig;
import io.csvchange.runtime.OpResult;
import io.csvchange.runtime.PipelineNotification;
import io.csvchange.runtime.UpdateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@CommandLine.Command(name = "watch", mixinStandardHelpOptions = true,
        description = "Watch CSV files and back up, validate, log and diff every change")
public class WatchCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @CommandLine.Parameters(arity = "1..*", description = "Files to watch")
    List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--admin-port", arity = "0..1", fallbackValue = "-1",
            description = "Serve /status and /metrics on this port; without a value the configured port, 0 picks a free one")
    Integer adminPort;

    @CommandLine.Option(names = "--seconds", description = "Stop after this many seconds; 0 runs until interrupted", defaultValue = "0")
    long seconds;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final UpdateManager manager;
    private final PipelineConfig config;

    @Inject
    WatchCommand(UpdateManager manager, PipelineConfig config) {
        this.manager = manager;
        this.config = config;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        manager.start();
        manager.notifications().subscribe(n -> {
            if (n.type() == PipelineNotification.Type.CHANGE_LOGGED || n.type() == PipelineNotification.Type.ERROR) {
                out.printf("[%s] %s %s %s%n", n.at(), n.type(), n.path(), n.message());
                out.flush();
            }
        });
        for (Path f : files) {
            OpResult<Path> r = manager.watch(f).join();
            if (!r.success()) {
                spec.commandLine().getErr().println("Cannot watch " + f + ": " + r.error());
                manager.close();
                return 2;
            }
            out.println("Watching " + r.value());
        }
        out.flush();

        StatusServer admin = null;
        if (adminPort != null) {
            admin = new StatusServer(adminPort < 0 ? config.adminPort() : adminPort, manager);
            admin.start();
            out.println("Status on http://localhost:" + admin.port() + "/status");
            out.flush();
        }
        CountDownLatch stop = new CountDownLatch(1);
        Thread hook = new Thread(stop::countDown, "csv-change-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            if (seconds > 0) {
                stop.await(seconds, TimeUnit.SECONDS);
            } else {
                stop.await();
            }
        } finally {
            if (admin != null) admin.close();
            manager.close();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down");
            }
        }
        return 0;
    }
}
