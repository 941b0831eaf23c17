package org.github.zzf.mqtt.bus.exception;

public class DuplicateLabelException extends BusException {

    public DuplicateLabelException(String label) {
        super("label already in use (" + label + ")");
    }

}
