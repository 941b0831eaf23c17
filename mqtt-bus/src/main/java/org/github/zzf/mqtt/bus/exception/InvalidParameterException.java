package org.github.zzf.mqtt.bus.exception;

/**
 * A parameter value can not be placed into a topic, e.g. an empty single-level value or one that contains
 * a level separator or a wildcard character.
 */
public class InvalidParameterException extends BusException {

    public InvalidParameterException(String name, String reason) {
        super("invalid parameter (" + name + "): " + reason);
    }

}
