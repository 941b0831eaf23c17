package org.github.zzf.mqtt.bus.exception;

/**
 * Base class of every error raised by the bus itself.
 * <p>Errors raised by the transport are passed through unchanged and are not wrapped.</p>
 */
public class BusException extends RuntimeException {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }

}
