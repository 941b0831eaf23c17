package org.github.zzf.mqtt.bus.transport;

/**
 * Lifecycle and message events of a {@link TransportConnection}.
 * <p>A transport never invokes two callbacks of the same connection concurrently.</p>
 */
public interface TransportListener {

    /**
     * the broker accepted a (re)connect
     */
    void onConnect();

    /**
     * a reconnect attempt starts
     */
    void onReconnect();

    /**
     * the connection went offline, a reconnect may follow
     */
    void onOffline();

    /**
     * the network connection was closed
     */
    void onClose();

    void onError(Throwable cause);

    void onMessage(InboundMessage message);

}
