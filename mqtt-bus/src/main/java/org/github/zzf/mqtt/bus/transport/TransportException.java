package org.github.zzf.mqtt.bus.transport;

/**
 * An error of the connection to the broker.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

}
