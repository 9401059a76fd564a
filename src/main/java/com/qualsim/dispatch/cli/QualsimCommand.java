package com.qualsim.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Qualsim.
 * Routes to subcommands: simulate, validate, inspect.
 */
@Command(
        name = "qualsim",
        mixinStandardHelpOptions = true,
        version = "Qualsim 0.1.0",
        description = "Branching simulator for objects described by qualitative attributes",
        subcommands = {
                SimulateCommand.class,
                ValidateCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class QualsimCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
