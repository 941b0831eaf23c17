package org.github.zzf.mqtt.bus.transport;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * An established connection returned by {@link Transport#connect}.
 * <p>Requests complete through the returned stage; errors of the transport are reported through it
 * unchanged.</p>
 */
public interface TransportConnection {

    String clientIdentifier();

    /**
     * @return the CONNACK of the first successful connect
     */
    ConnAck connAck();

    boolean connected();

    /**
     * @return true while the connection is lost and a reconnect is scheduled or in progress
     */
    boolean reconnecting();

    /**
     * set the listener of lifecycle and message events. Replaces any previous listener.
     */
    void listener(TransportListener listener);

    /**
     * @return the granted QoS of the Topic Filter (0x80 for failure)
     */
    CompletionStage<List<Integer>> subscribe(String topicFilter, int qos);

    CompletionStage<Void> unsubscribe(String topicFilter);

    CompletionStage<Void> publish(String topicName, byte[] payload, int qos, boolean retain);

    /**
     * close the connection and stop reconnecting
     *
     * @param force don't wait for in-flight messages to be acknowledged
     */
    CompletionStage<Void> end(boolean force);

}
