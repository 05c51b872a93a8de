package com.wetwire.importer;

import com.wetwire.importer.cli.ImportCommand;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main entry point for the CloudFormation template importer.
 * Converts declarative infrastructure templates into Java source that declares
 * the same resources against a typed resource library.
 */
@Command(
        name = "cfn-import",
        mixinStandardHelpOptions = true,
        version = "cfn-template-importer 1.0.0",
        subcommands = { ImportCommand.class }
)
public class ImporterApplication implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ImporterApplication())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
