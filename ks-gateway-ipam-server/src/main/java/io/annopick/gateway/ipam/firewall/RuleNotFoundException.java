package io.annopick.gateway.ipam.firewall;

public class RuleNotFoundException extends FirewallException {

    public RuleNotFoundException(String message) {
        super(message);
    }

    public RuleNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
