package org.github.zzf.mqtt.bus.exception;

/**
 * The pattern string can not be compiled into a TopicPattern.
 */
public class InvalidPatternException extends BusException {

    private final String pattern;

    public InvalidPatternException(String pattern, String reason) {
        super("invalid pattern (" + pattern + "): " + reason);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }

}
