package org.github.zzf.mqtt.bus.exception;

public class AlreadySubscribedException extends BusException {

    public AlreadySubscribedException(String topicFilter) {
        super("already subscribed to topic (" + topicFilter + ")");
    }

}
