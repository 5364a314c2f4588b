package io.annopick.gateway.ipam.firewall;

import lombok.Getter;

/**
 * An external command could not be started or exited with a non-zero status.
 */
@Getter
public class CommandException extends FirewallException {

    private final String command;
    private final int exitCode;
    private final String stderr;

    public CommandException(String command, int exitCode, String stderr) {
        super(String.format("Command \"%s\" exited with code %d: %s", command, exitCode, stderr.trim()));
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public CommandException(String command, Throwable cause) {
        super(String.format("Error while launching command: \"%s\"", command), cause);
        this.command = command;
        this.exitCode = -1;
        this.stderr = "";
    }
}
