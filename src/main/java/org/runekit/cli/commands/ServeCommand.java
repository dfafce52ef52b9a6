package org.runekit.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.runekit.cli.CommandLineInterface;
import org.runekit.http.OverlayHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the overlay engine with a headless scene surface behind the HTTP API until the
 * process is interrupted.
 */
@Command(
    name = "serve",
    description = "Start the overlay engine and its HTTP API"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
            return 1;
        }

        OverlayHost host = OverlayHost.start(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down overlay engine");
            host.close();
            stopped.countDown();
        }, "overlay-shutdown"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            host.close();
        }
        return 0;
    }
}
