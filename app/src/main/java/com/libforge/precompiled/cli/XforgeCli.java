package com.libforge.precompiled.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Entry point of the {@code xforge} command line.
 */
@Command(
        name = "xforge",
        mixinStandardHelpOptions = true,
        version = "xforge 0.1.0",
        description = "Validates signed precompiled releases and manages signing keys.",
        subcommands = {ValidatePrecompiledCommand.class, KeygenCommand.class}
)
public class XforgeCli implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new XforgeCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
