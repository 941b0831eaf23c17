package org.github.zzf.mqtt.bus;

/**
 * Receives the messages dispatched to a label.
 */
@FunctionalInterface
public interface MessageListener {

    void onMessage(Message message);

}
