package org.github.zzf.mqtt.bus.exception;

public class NotSubscribedException extends BusException {

    public NotSubscribedException(String topicFilter) {
        super("not subscribed to topic (" + topicFilter + ")");
    }

}
