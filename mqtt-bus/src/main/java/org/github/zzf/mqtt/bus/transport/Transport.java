package org.github.zzf.mqtt.bus.transport;

import java.util.concurrent.CompletionStage;
import org.github.zzf.mqtt.bus.BusOptions;

/**
 * The MQTT client the bus is layered on.
 */
public interface Transport {

    /**
     * open a connection to the broker named by {@link BusOptions#getUrl()}
     *
     * @param options connect options
     * @return a stage that completes with the connection once the broker accepted it (CONNACK), or fails with
     * the cause of the first error
     */
    CompletionStage<TransportConnection> connect(BusOptions options);

}
