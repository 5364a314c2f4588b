package io.annopick.gateway.ipam.firewall;

public class FirewallException extends RuntimeException {

    public FirewallException(String message) {
        super(message);
    }

    public FirewallException(String message, Throwable cause) {
        super(message, cause);
    }
}
