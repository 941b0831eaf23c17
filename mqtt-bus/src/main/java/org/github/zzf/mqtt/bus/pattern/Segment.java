package org.github.zzf.mqtt.bus.pattern;

import java.util.Objects;

/**
 * One level of a {@link TopicPattern}.
 * <p>A LITERAL segment carries the level text, a parameter segment carries the parameter name.</p>
 */
public final class Segment {

    public enum Type {
        LITERAL,
        SINGLE_LEVEL,
        MULTI_LEVEL,
    }

    private final Type type;
    private final String value;

    private Segment(Type type, String value) {
        this.type = type;
        this.value = value;
    }

    static Segment literal(String text) {
        return new Segment(Type.LITERAL, text);
    }

    static Segment singleLevel(String name) {
        return new Segment(Type.SINGLE_LEVEL, name);
    }

    static Segment multiLevel(String name) {
        return new Segment(Type.MULTI_LEVEL, name);
    }

    public Type type() {
        return type;
    }

    public boolean parameter() {
        return type != Type.LITERAL;
    }

    /**
     * @return the level text of a LITERAL segment
     */
    public String text() {
        if (type != Type.LITERAL) {
            throw new IllegalStateException("not a literal segment: " + this);
        }
        return value;
    }

    /**
     * @return the parameter name of a parameter segment
     */
    public String name() {
        if (type == Type.LITERAL) {
            throw new IllegalStateException("not a parameter segment: " + this);
        }
        return value;
    }

    /**
     * @return the segment as it appears in a MQTT Topic Filter
     */
    String topicFilterLevel() {
        switch (type) {
            case SINGLE_LEVEL:
                return TopicPattern.SINGLE_LEVEL_WILDCARD;
            case MULTI_LEVEL:
                return TopicPattern.MULTI_LEVEL_WILDCARD;
            default:
                return value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Segment that = (Segment) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case SINGLE_LEVEL:
                return TopicPattern.SINGLE_LEVEL_WILDCARD + value;
            case MULTI_LEVEL:
                return TopicPattern.MULTI_LEVEL_WILDCARD + value;
            default:
                return value;
        }
    }

}
