package org.github.zzf.mqtt.bus.state;

/**
 * Connection status of a Bus.
 * <pre>
 *     READY -> CONNECTING -> CONNECTED | ERROR
 *     CONNECTED -> RECONNECTING | OFFLINE | CLOSED | ERROR
 *     RECONNECTING -> CONNECTED | CLOSED | ERROR
 *     OFFLINE -> RECONNECTING | CLOSED | ERROR
 * </pre>
 * <p>CLOSED ends a connection attempt, the next connect starts over from READY. ERROR is not terminal.</p>
 */
public enum Status {
    READY,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    OFFLINE,
    CLOSED,
    ERROR,
}
