package com.timeslice.cli.commands;

import com.timeslice.clock.SystemTimeSource;
import com.timeslice.clock.TimeSource;
import com.timeslice.clock.VirtualTimeSource;
import com.timeslice.scheduler.SchedulerConfig;
import picocli.CommandLine.Command;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Displays the version and the scheduler defaults a plain {@code simulate} run uses.
 */
@Command(name = "version", description = "Show version and scheduler defaults")
public class VersionCommand implements Callable<Integer> {

    static final String VERSION = "1.0-SNAPSHOT";

    PrintStream out = System.out;

    @Override
    public Integer call() {
        SchedulerConfig defaults = SchedulerConfig.defaults();

        out.println("Timeslice " + VERSION + " (Java " + System.getProperty("java.version") + ")");
        out.println();
        out.println("Scheduler defaults:");
        out.println("  Time quantum:       " + defaults.getTimeQuantum() + "s");
        out.println("  Idle poll interval: " + defaults.getIdlePollIntervalMs() + " ms");
        out.println("  Stop timeout:       " + defaults.getStopTimeoutMs() + " ms");
        out.println("  Pause between slices: " + defaults.getLoopPauseMs() + " ms");
        out.println();
        out.println("Clocks:");
        for (TimeSource clock : List.of(new SystemTimeSource(), new VirtualTimeSource())) {
            String marker = clock.getName().equals(defaults.getTimeSource().getName()) ? " (default)" : " (--virtual)";
            out.println("  - " + clock.getName() + marker);
        }
        return 0;
    }
}
