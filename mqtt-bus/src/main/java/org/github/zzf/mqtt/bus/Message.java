package org.github.zzf.mqtt.bus;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.github.zzf.mqtt.bus.transport.InboundMessage;

/**
 * A received message enriched with the label it was dispatched to and the parameters extracted from its
 * topic.
 */
public class Message {

    private final String label;
    private final InboundMessage inbound;
    private final Map<String, Object> params;

    public Message(String label, InboundMessage inbound, Map<String, Object> params) {
        this.label = label;
        this.inbound = inbound;
        this.params = params;
    }

    public String label() {
        return label;
    }

    public String topic() {
        return inbound.topicName();
    }

    public byte[] payload() {
        return inbound.payload();
    }

    public String payloadAsString() {
        return new String(inbound.payload(), UTF_8);
    }

    public int qos() {
        return inbound.qos();
    }

    public boolean retain() {
        return inbound.retain();
    }

    public boolean dup() {
        return inbound.dup();
    }

    /**
     * @return parameter name -> String (single-level) or List&lt;String&gt; (multi-level)
     */
    public Map<String, Object> params() {
        return params;
    }

    /**
     * @param name name of a single-level parameter
     * @return the value, or null if the pattern has no such parameter
     */
    public String param(String name) {
        Object v = params.get(name);
        if (v != null && !(v instanceof String)) {
            throw new IllegalArgumentException("not a single-level parameter: " + name);
        }
        return (String) v;
    }

    /**
     * @param name name of a multi-level parameter
     * @return the levels, or null if the pattern has no such parameter
     */
    public List<String> paramList(String name) {
        Object v = params.get(name);
        if (v == null) {
            return null;
        }
        if (!(v instanceof List)) {
            throw new IllegalArgumentException("not a multi-level parameter: " + name);
        }
        List<String> levels = new ArrayList<>();
        for (Object level : (List<?>) v) {
            levels.add((String) level);
        }
        return levels;
    }

    @Override
    public String toString() {
        return "{\"label\":\"" + label + "\",\"message\":" + inbound + ",\"params\":\"" + params + "\"}";
    }

}
