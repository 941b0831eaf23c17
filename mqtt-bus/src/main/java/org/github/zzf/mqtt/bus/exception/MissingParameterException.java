package org.github.zzf.mqtt.bus.exception;

public class MissingParameterException extends BusException {

    private final String name;

    public MissingParameterException(String name) {
        super("missing parameter (" + name + ")");
        this.name = name;
    }

    public String name() {
        return name;
    }

}
