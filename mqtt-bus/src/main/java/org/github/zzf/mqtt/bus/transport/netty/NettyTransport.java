package org.github.zzf.mqtt.bus.transport.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.BusOptions;
import org.github.zzf.mqtt.bus.transport.Transport;
import org.github.zzf.mqtt.bus.transport.TransportConnection;

/**
 * MQTT 3.1.1 over TCP on Netty.
 * <p>Every connection runs on a single EventLoop: the one it creates for itself, or one taken from the
 * group passed to the constructor.</p>
 */
@Slf4j
public class NettyTransport implements Transport {

    static final int DEFAULT_PORT = 1883;

    @Nullable
    private final EventLoopGroup eventLoopGroup;

    public NettyTransport() {
        this(null);
    }

    /**
     * @param eventLoopGroup group to use, null to create an exclusive EventLoop for each connection
     */
    public NettyTransport(@Nullable EventLoopGroup eventLoopGroup) {
        this.eventLoopGroup = eventLoopGroup;
    }

    @Override
    public CompletionStage<TransportConnection> connect(BusOptions options) {
        InetSocketAddress remoteAddress;
        try {
            remoteAddress = remoteAddress(options.getUrl());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        NettyConnection connection;
        if (eventLoopGroup == null) {
            String threadName = "mqtt-bus-" + (options.getClientId() == null ? "" : options.getClientId());
            EventLoopGroup exclusive = new NioEventLoopGroup(1, new DefaultThreadFactory(threadName));
            connection = new NettyConnection(options, remoteAddress, exclusive, true);
        }
        else {
            connection = new NettyConnection(options, remoteAddress, eventLoopGroup, false);
        }
        log.debug("Client({}) connect to {}", options.getClientId(), remoteAddress);
        return connection.open();
    }

    /**
     * @param url mqtt://host:port or tcp://host:port, port defaults to 1883
     */
    static InetSocketAddress remoteAddress(String url) {
        if (url == null) {
            throw new IllegalArgumentException("url is required");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("illegal url: " + url, e);
        }
        if (!"mqtt".equals(uri.getScheme()) && !"tcp".equals(uri.getScheme())) {
            throw new IllegalArgumentException("unsupported scheme: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("no host: " + url);
        }
        int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }

}
