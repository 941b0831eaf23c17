package org.github.zzf.mqtt.bus.transport;

/**
 * Connection acknowledge info.
 */
public class ConnAck {

    public static final int ACCEPTED = 0x00;

    private final boolean sessionPresent;
    private final int returnCode;

    public ConnAck(boolean sessionPresent, int returnCode) {
        this.sessionPresent = sessionPresent;
        this.returnCode = returnCode;
    }

    public boolean sessionPresent() {
        return sessionPresent;
    }

    public int returnCode() {
        return returnCode;
    }

    public boolean connectionAccepted() {
        return returnCode == ACCEPTED;
    }

    @Override
    public String toString() {
        return "{\"sessionPresent\":" + sessionPresent + ",\"returnCode\":" + returnCode + "}";
    }

}
