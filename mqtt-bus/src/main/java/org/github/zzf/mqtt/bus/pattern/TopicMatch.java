package org.github.zzf.mqtt.bus.pattern;

import java.util.List;

/**
 * The result of a successful {@link TopicPattern#match(String)}.
 * <p>Holds the captured values in the order of the pattern's parameter segments: a {@code String} for a
 * single-level parameter, a {@code List<String>} for a multi-level parameter.</p>
 */
public final class TopicMatch {

    private final TopicPattern pattern;
    private final String topic;
    private final List<Object> captured;

    TopicMatch(TopicPattern pattern, String topic, List<Object> captured) {
        this.pattern = pattern;
        this.topic = topic;
        this.captured = captured;
    }

    public TopicPattern pattern() {
        return pattern;
    }

    public String topic() {
        return topic;
    }

    List<Object> captured() {
        return captured;
    }

    @Override
    public String toString() {
        return "{\"pattern\":\"" + pattern.pattern() + "\",\"topic\":\"" + topic + "\",\"captured\":" + captured + "}";
    }

}
