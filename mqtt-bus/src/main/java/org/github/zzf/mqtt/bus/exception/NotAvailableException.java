package org.github.zzf.mqtt.bus.exception;

public class NotAvailableException extends BusException {

    public NotAvailableException() {
        super("bus not available");
    }

}
