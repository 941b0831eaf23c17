package org.github.zzf.mqtt.bus.exception;

/**
 * The number of parameter values differs from the number of parameter segments of the pattern.
 */
public class ParameterCountMismatchException extends BusException {

    private final int expected;
    private final int actual;

    public ParameterCountMismatchException(int expected, int actual) {
        super("wrong parameter count, got " + actual + ", expected " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }

}
