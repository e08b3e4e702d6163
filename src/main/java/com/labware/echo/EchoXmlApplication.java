package com.labware.echo;

import com.labware.echo.cli.InspectCommand;
import picocli.CommandLine;

/**
 * Launcher for {@code echo-xml inspect}.
 */
public class EchoXmlApplication {

    /**
     * Command line wired the way the launcher runs it: document kinds match
     * case-insensitively ({@code -k survey} and {@code -k SURVEY} are equal).
     */
    public static CommandLine commandLine() {
        return new CommandLine(new InspectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
