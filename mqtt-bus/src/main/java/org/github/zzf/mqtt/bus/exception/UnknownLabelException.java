package org.github.zzf.mqtt.bus.exception;

public class UnknownLabelException extends BusException {

    private final String label;

    public UnknownLabelException(String label) {
        super("unknown label (" + label + ")");
        this.label = label;
    }

    public String label() {
        return label;
    }

}
