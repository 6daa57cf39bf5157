package com.libforge.precompiled.cli;

import com.libforge.precompiled.core.security.Ed25519Keys;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Generates an Ed25519 signing key pair for a release pipeline.
 */
@Command(
        name = "keygen",
        mixinStandardHelpOptions = true,
        description = "Generates an Ed25519 key pair. Put public_key into xforge.yaml and keep private_key secret."
)
public class KeygenCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Ed25519Keys keys = Ed25519Keys.generate();
        PrintWriter out = spec.commandLine().getOut();
        out.println("public_key=" + keys.publicKeyHex());
        out.println("private_key=" + keys.privateKeyHex());
        out.flush();
        return CommandLine.ExitCode.OK;
    }
}
