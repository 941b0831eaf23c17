package org.github.zzf.mqtt.bus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Connect options of a {@link Bus}.
 * <p>Defaults may be changed with the JVM system properties {@code mqtt.bus.keepAlive} (seconds),
 * {@code mqtt.bus.reconnectPeriod} (ms) and {@code mqtt.bus.connectTimeout} (ms).</p>
 */
@Data
@Accessors(chain = true)
public class BusOptions {

    private String clientId;
    /**
     * mqtt://host:port
     */
    private String url;
    private int keepAlive = Integer.getInteger("mqtt.bus.keepAlive", 60);
    private boolean cleanSession = true;
    private String username;
    private String password;
    /**
     * interval between two reconnect attempts, 0 disables reconnecting
     */
    private long reconnectPeriod = Long.getLong("mqtt.bus.reconnectPeriod", 1000L);
    private long connectTimeout = Long.getLong("mqtt.bus.connectTimeout", 30_000L);
    private Will will;

    public BusOptions copy() {
        return new BusOptions()
            .setClientId(clientId)
            .setUrl(url)
            .setKeepAlive(keepAlive)
            .setCleanSession(cleanSession)
            .setUsername(username)
            .setPassword(password)
            .setReconnectPeriod(reconnectPeriod)
            .setConnectTimeout(connectTimeout)
            .setWill(will);
    }

    @Override
    public String toString() {
        // no password
        return "{\"clientId\":\"" + clientId + "\",\"url\":\"" + url + "\",\"keepAlive\":" + keepAlive
            + ",\"cleanSession\":" + cleanSession + ",\"reconnectPeriod\":" + reconnectPeriod
            + ",\"connectTimeout\":" + connectTimeout + "}";
    }

    /**
     * the Will Message published by the broker when the connection is lost
     */
    @Data
    @Accessors(chain = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Will {

        private String topic;
        private byte[] payload;
        private int qos;
        private boolean retain;

    }

}
