package org.github.zzf.mqtt.bus.exception;

public class AlreadyAvailableException extends BusException {

    public AlreadyAvailableException() {
        super("bus already available");
    }

}
