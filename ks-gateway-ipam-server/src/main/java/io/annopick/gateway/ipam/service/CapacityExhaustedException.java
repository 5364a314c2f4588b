package io.annopick.gateway.ipam.service;

/**
 * Every attempt to claim a random connection port collided with an existing mapping.
 */
public class CapacityExhaustedException extends RuntimeException {

    public CapacityExhaustedException(String message) {
        super(message);
    }
}
