package io.annopick.gateway.ipam.firewall;

import lombok.Value;

@Value
public class CommandResult {
    String command;
    int exitCode;
    String stdout;
    String stderr;
}
