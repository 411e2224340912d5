package com.timeslice.cli;

import ch.qos.logback.classic.Level;
import com.timeslice.cli.commands.SimulateCommand;
import com.timeslice.cli.commands.VersionCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Timeslice CLI - main entry point and command dispatcher.
 * 
 * Root command with global options; the actual work is done by subcommands.
 */
@Command(
    name = "timeslice",
    description = "Timeslice - priority round-robin scheduling simulator",
    version = "Timeslice v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        SimulateCommand.class,
        VersionCommand.class
    }
)
public class TimesliceCli implements Callable<Integer> { // Callable<Integer> so the command returns an exit code
    
    // Global option, read by subcommands through @ParentCommand
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    private boolean verbose;
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TimesliceCli()).execute(args);
        System.exit(exitCode);
    }
    
    @Override
    public Integer call() {
        // No subcommand: display usage information
        new CommandLine(this).usage(System.out);
        return 0;
    }
    
    /**
     * Switches the application loggers to DEBUG when --verbose was given.
     * Called by subcommands before they start working.
     */
    public void applyLogLevel() {
        if (!verbose) {
            return;
        }
        Logger appLogger = LoggerFactory.getLogger("com.timeslice");
        if (appLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) appLogger).setLevel(Level.DEBUG);
        }
    }
}
