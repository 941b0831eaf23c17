package org.github.zzf.mqtt.bus.transport;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A Publish received from the broker, as handed over by the transport.
 */
public class InboundMessage {

    private final String topicName;
    private final byte[] payload;
    private final int qos;
    private final boolean retain;
    private final boolean dup;

    public InboundMessage(String topicName, byte[] payload, int qos, boolean retain, boolean dup) {
        this.topicName = checkNotNull(topicName, "topicName");
        this.payload = checkNotNull(payload, "payload");
        this.qos = qos;
        this.retain = retain;
        this.dup = dup;
    }

    public String topicName() {
        return topicName;
    }

    public byte[] payload() {
        return payload;
    }

    public int qos() {
        return qos;
    }

    public boolean retain() {
        return retain;
    }

    public boolean dup() {
        return dup;
    }

    @Override
    public String toString() {
        return "{\"topicName\":\"" + topicName + "\",\"payload\":" + payload.length
            + ",\"qos\":" + qos + ",\"retain\":" + retain + ",\"dup\":" + dup + "}";
    }

}
