package org.github.zzf.mqtt.bus.transport.netty;

import static io.netty.channel.ChannelFutureListener.CLOSE;
import static io.netty.channel.ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.util.concurrent.ScheduledFuture;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.BusOptions;
import org.github.zzf.mqtt.bus.transport.ConnAck;
import org.github.zzf.mqtt.bus.transport.InboundMessage;
import org.github.zzf.mqtt.bus.transport.TransportConnection;
import org.github.zzf.mqtt.bus.transport.TransportException;
import org.github.zzf.mqtt.bus.transport.TransportListener;

/**
 * A connection to one broker that reconnects every {@link BusOptions#getReconnectPeriod()} ms after the
 * Channel was lost.
 * <p>Events follow the order close -> offline -> reconnect -> connect (or close again). All state changes
 * happen on {@link #eventLoop}; the request methods may be called from any thread.</p>
 */
@Slf4j
public class NettyConnection implements TransportConnection {

    static final int MAX_MESSAGE_SIZE = Integer.getInteger("mqtt.bus.maxMessageSize", 1024 * 1024);

    private final BusOptions options;
    private final InetSocketAddress remoteAddress;
    private final EventLoopGroup eventLoopGroup;
    private final boolean exclusiveEventLoop;
    private final EventLoop eventLoop;

    private final AtomicInteger packetIdentifier = new AtomicInteger(new Random().nextInt(0xFFFF));
    private final ConcurrentMap<Integer, CompletableFuture<Object>> unAckPackets = new ConcurrentHashMap<>();
    // QoS 2 Publish received, waiting for PubRel
    private final Set<Integer> inboundQos2 = new HashSet<>();
    // Topic Filter -> QoS, subscribed again after a reconnect without Session
    private final Map<String, Integer> subscriptions = new ConcurrentHashMap<>();

    private final CompletableFuture<TransportConnection> firstConnect = new CompletableFuture<>();
    private CompletableFuture<Void> endFuture;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> connAckTimeoutTask;

    private volatile Channel channel;
    private volatile ConnAck connAck;
    private volatile TransportListener listener;
    private volatile boolean connected;
    private volatile boolean reconnecting;
    private volatile boolean ending;

    NettyConnection(BusOptions options, InetSocketAddress remoteAddress, EventLoopGroup eventLoopGroup,
        boolean exclusiveEventLoop) {
        this.options = options;
        this.remoteAddress = remoteAddress;
        this.eventLoopGroup = eventLoopGroup;
        this.exclusiveEventLoop = exclusiveEventLoop;
        this.eventLoop = eventLoopGroup.next();
    }

    CompletableFuture<TransportConnection> open() {
        eventLoop.execute(this::doConnect);
        return firstConnect;
    }

    CompletableFuture<TransportConnection> firstConnect() {
        return firstConnect;
    }

    private void doConnect() {
        log.debug("Client({}) connecting to {}", clientIdentifier(), remoteAddress);
        new Bootstrap()
            .group(eventLoop).channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) options.getConnectTimeout())
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline()
                        .addLast(new MqttDecoder(MAX_MESSAGE_SIZE))
                        .addLast(MqttEncoder.INSTANCE)
                        .addLast(MqttClientHandler.HANDLER_NAME, new MqttClientHandler(NettyConnection.this));
                }
            })
            .connect(remoteAddress)
            .addListener((ChannelFuture f) -> {
                if (f.isSuccess()) {
                    channelConnected(f.channel());
                }
                else {
                    connectFailed(f.cause());
                }
            });
    }

    /**
     * the TCP connection is up, send the Connect
     */
    void channelConnected(Channel ch) {
        log.debug("Client({}) Channel connected to remote broker -> {}", clientIdentifier(), ch);
        this.channel = ch;
        if (ending) {
            ch.close();
            return;
        }
        ch.writeAndFlush(connectMessage()).addListener(FIRE_EXCEPTION_ON_FAILURE);
        connAckTimeoutTask = eventLoop.schedule(() -> {
            if (channel == ch && !connected) {
                ch.pipeline().fireExceptionCaught(new TransportException("no CONNACK in " + options.getConnectTimeout() + "ms"));
            }
        }, options.getConnectTimeout(), MILLISECONDS);
    }

    private MqttConnectMessage connectMessage() {
        MqttMessageBuilders.ConnectBuilder builder = MqttMessageBuilders.connect()
            .protocolVersion(MqttVersion.MQTT_3_1_1)
            .clientId(options.getClientId() == null ? "" : options.getClientId())
            .cleanSession(options.isCleanSession())
            .keepAlive(options.getKeepAlive())
            .username(options.getUsername())
            .password(options.getPassword() == null ? null : options.getPassword().getBytes(UTF_8));
        BusOptions.Will will = options.getWill();
        if (will != null) {
            builder.willFlag(true)
                .willTopic(will.getTopic())
                .willMessage(will.getPayload())
                .willQoS(MqttQoS.valueOf(will.getQos()))
                .willRetain(will.isRetain());
        }
        return builder.build();
    }

    private void connectFailed(Throwable cause) {
        if (!firstConnect.isDone()) {
            log.warn("Client({}) connect to {} failed", clientIdentifier(), remoteAddress, cause);
            firstConnect.completeExceptionally(cause);
            shutdown();
            return;
        }
        log.warn("Client({}) reconnect to {} failed: {}", clientIdentifier(), remoteAddress, cause.toString());
        fire(TransportListener::onClose);
        if (ending) {
            finishEnd();
            return;
        }
        scheduleReconnect();
    }

    void connAck(Channel ch, MqttConnAckMessage msg) {
        if (ch != channel) {
            return;
        }
        cancel(connAckTimeoutTask);
        ConnAck ack = new ConnAck(msg.variableHeader().isSessionPresent(),
            msg.variableHeader().connectReturnCode().byteValue() & 0xFF);
        log.debug("Client({}) receive ConnAck: {}", clientIdentifier(), ack);
        if (!ack.connectionAccepted()) {
            TransportException cause = new TransportException("connection refused, return code: " + ack.returnCode());
            if (!firstConnect.isDone()) {
                firstConnect.completeExceptionally(cause);
            }
            else {
                fire(l -> l.onError(cause));
            }
            ch.close();
            return;
        }
        this.connected = true;
        this.reconnecting = false;
        if (!firstConnect.isDone()) {
            this.connAck = ack;
            firstConnect.complete(this);
            return;
        }
        fire(TransportListener::onConnect);
        if (!ack.sessionPresent()) {
            resubscribe(ch);
        }
    }

    private void resubscribe(Channel ch) {
        subscriptions.forEach((topicFilter, qos) -> {
            log.debug("Client({}) resubscribe: {}", clientIdentifier(), topicFilter);
            int id = nextPacketIdentifier();
            unAckPackets(id).whenComplete((ack, t) -> {
                if (t != null) {
                    log.warn("Client({}) resubscribe {} failed", clientIdentifier(), topicFilter, t);
                }
            });
            ch.writeAndFlush(subscribeMessage(id, topicFilter, qos)).addListener(failOnWriteFailure(id));
        });
    }

    void channelInactive(Channel ch) {
        if (ch != channel) {
            return;
        }
        log.debug("Client({}) Channel was closed: {}", clientIdentifier(), ch);
        this.connected = false;
        cancel(connAckTimeoutTask);
        failUnAckPackets(new TransportException("connection closed"));
        if (options.isCleanSession()) {
            inboundQos2.clear();
        }
        if (!firstConnect.isDone()) {
            firstConnect.completeExceptionally(new TransportException("connection closed before CONNACK"));
        }
        if (firstConnect.isCompletedExceptionally()) {
            shutdown();
            return;
        }
        fire(TransportListener::onClose);
        if (ending) {
            finishEnd();
            return;
        }
        scheduleReconnect();
    }

    void exceptionCaught(Channel ch, Throwable cause) {
        if (ch != channel) {
            return;
        }
        if (!firstConnect.isDone()) {
            firstConnect.completeExceptionally(cause);
            return;
        }
        fire(l -> l.onError(cause));
    }

    private void scheduleReconnect() {
        long period = options.getReconnectPeriod();
        if (period <= 0) {
            this.reconnecting = false;
            log.info("Client({}) connection lost, reconnect disabled", clientIdentifier());
            shutdown();
            return;
        }
        if (!reconnecting) {
            this.reconnecting = true;
            fire(TransportListener::onOffline);
        }
        reconnectTask = eventLoop.schedule(() -> {
            reconnectTask = null;
            if (ending) {
                return;
            }
            log.info("Client({}) reconnecting to {}", clientIdentifier(), remoteAddress);
            fire(TransportListener::onReconnect);
            doConnect();
        }, period, MILLISECONDS);
    }

    void publishReceived(Channel ch, MqttPublishMessage msg) {
        int qos = msg.fixedHeader().qosLevel().value();
        int id = msg.variableHeader().packetId();
        InboundMessage message = new InboundMessage(msg.variableHeader().topicName(),
            ByteBufUtil.getBytes(msg.payload()), qos, msg.fixedHeader().isRetain(), msg.fixedHeader().isDup());
        log.debug("Client({}) receive Publish: {}", clientIdentifier(), message);
        switch (qos) {
            case 0:
                fire(l -> l.onMessage(message));
                break;
            case 1:
                fire(l -> l.onMessage(message));
                ch.writeAndFlush(ackMessage(MqttMessageType.PUBACK, id)).addListener(FIRE_EXCEPTION_ON_FAILURE);
                break;
            case 2:
                // a duplicate is acknowledged again but not delivered twice
                if (inboundQos2.add(id)) {
                    fire(l -> l.onMessage(message));
                }
                ch.writeAndFlush(ackMessage(MqttMessageType.PUBREC, id)).addListener(FIRE_EXCEPTION_ON_FAILURE);
                break;
            default:
                throw new TransportException("illegal QoS: " + qos);
        }
    }

    void pubRec(Channel ch, int packetIdentifier) {
        ch.writeAndFlush(ackMessage(MqttMessageType.PUBREL, packetIdentifier)).addListener(FIRE_EXCEPTION_ON_FAILURE);
    }

    void pubRel(Channel ch, int packetIdentifier) {
        inboundQos2.remove(packetIdentifier);
        ch.writeAndFlush(ackMessage(MqttMessageType.PUBCOMP, packetIdentifier)).addListener(FIRE_EXCEPTION_ON_FAILURE);
    }

    static MqttMessage ackMessage(MqttMessageType type, int packetIdentifier) {
        // Bits 3,2,1 and 0 of the fixed header in the PUBREL Control Packet are reserved and MUST be set to 0,0,1,0
        MqttQoS qos = type == MqttMessageType.PUBREL ? MqttQoS.AT_LEAST_ONCE : MqttQoS.AT_MOST_ONCE;
        return new MqttMessage(new MqttFixedHeader(type, false, qos, false, 2),
            MqttMessageIdVariableHeader.from(packetIdentifier));
    }

    static MqttMessage headerOnlyMessage(MqttMessageType type) {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }

    private static MqttMessage subscribeMessage(int packetIdentifier, String topicFilter, int qos) {
        return MqttMessageBuilders.subscribe()
            .messageId(packetIdentifier)
            .addSubscription(MqttQoS.valueOf(qos), topicFilter)
            .build();
    }

    @Override
    public CompletionStage<List<Integer>> subscribe(String topicFilter, int qos) {
        Channel ch = activeChannel();
        if (ch == null) {
            return notActive();
        }
        int id = nextPacketIdentifier();
        CompletableFuture<Object> future = unAckPackets(id);
        log.debug("Client({}) subscribe: {}, qos: {}", clientIdentifier(), topicFilter, qos);
        ch.writeAndFlush(subscribeMessage(id, topicFilter, qos)).addListener(failOnWriteFailure(id));
        return future.thenApply(ack -> {
            List<Integer> granted = new ArrayList<>();
            for (Object grantedQos : (List<?>) ack) {
                granted.add((Integer) grantedQos);
            }
            if (granted.contains(MqttQoS.FAILURE.value())) {
                log.warn("Client({}) subscribe {} was rejected by the broker", clientIdentifier(), topicFilter);
            }
            else {
                subscriptions.put(topicFilter, qos);
            }
            return granted;
        });
    }

    @Override
    public CompletionStage<Void> unsubscribe(String topicFilter) {
        Channel ch = activeChannel();
        if (ch == null) {
            return notActive();
        }
        int id = nextPacketIdentifier();
        CompletableFuture<Object> future = unAckPackets(id);
        log.debug("Client({}) unsubscribe: {}", clientIdentifier(), topicFilter);
        ch.writeAndFlush(MqttMessageBuilders.unsubscribe().messageId(id).addTopicFilter(topicFilter).build())
            .addListener(failOnWriteFailure(id));
        return future.thenApply(ack -> {
            subscriptions.remove(topicFilter);
            return null;
        });
    }

    /**
     * QoS 0 completes once the Publish was written, QoS 1 on PubAck, QoS 2 on PubComp
     */
    @Override
    public CompletionStage<Void> publish(String topicName, byte[] payload, int qos, boolean retain) {
        Channel ch = activeChannel();
        if (ch == null) {
            return notActive();
        }
        MqttMessageBuilders.PublishBuilder builder = MqttMessageBuilders.publish()
            .topicName(topicName)
            .qos(MqttQoS.valueOf(qos))
            .retained(retain)
            .payload(Unpooled.wrappedBuffer(payload));
        if (qos == MqttQoS.AT_MOST_ONCE.value()) {
            CompletableFuture<Void> future = new CompletableFuture<>();
            ch.writeAndFlush(builder.build()).addListener((ChannelFuture f) -> {
                if (f.isSuccess()) {
                    future.complete(null);
                }
                else {
                    future.completeExceptionally(f.cause());
                }
            });
            return future;
        }
        int id = nextPacketIdentifier();
        CompletableFuture<Object> future = unAckPackets(id);
        ch.writeAndFlush(builder.messageId(id).build()).addListener(failOnWriteFailure(id));
        return future.thenApply(ack -> null);
    }

    @Override
    public CompletionStage<Void> end(boolean force) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            eventLoop.execute(() -> doEnd(force, future));
        } catch (RejectedExecutionException e) {
            // EventLoop already shut down, nothing left to close
            future.complete(null);
        }
        return future;
    }

    private void doEnd(boolean force, CompletableFuture<Void> future) {
        if (endFuture != null) {
            endFuture.whenComplete((v, t) -> future.complete(null));
            return;
        }
        log.info("Client({}) end, force: {}", clientIdentifier(), force);
        this.ending = true;
        this.reconnecting = false;
        this.endFuture = future;
        cancel(reconnectTask);
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            finishEnd();
            return;
        }
        if (force) {
            ch.close();
            return;
        }
        // wait for in-flight packets to be acknowledged, then disconnect
        CompletableFuture.allOf(unAckPackets.values().toArray(new CompletableFuture[0]))
            .whenComplete((v, t) -> eventLoop.execute(() ->
                ch.writeAndFlush(headerOnlyMessage(MqttMessageType.DISCONNECT)).addListener(CLOSE)));
    }

    private void finishEnd() {
        this.connected = false;
        failUnAckPackets(new TransportException("connection ended"));
        CompletableFuture<Void> future = endFuture;
        shutdown();
        if (future != null) {
            future.complete(null);
        }
    }

    private void shutdown() {
        if (exclusiveEventLoop) {
            eventLoopGroup.shutdownGracefully(0, 1, SECONDS);
        }
    }

    @Override
    public void listener(TransportListener listener) {
        this.listener = listener;
    }

    private void fire(Consumer<TransportListener> event) {
        TransportListener l = listener;
        if (l == null) {
            return;
        }
        try {
            event.accept(l);
        } catch (RuntimeException e) {
            log.error("Client({}) TransportListener failed", clientIdentifier(), e);
        }
    }

    private Channel activeChannel() {
        Channel ch = channel;
        return (connected && ch != null && ch.isActive()) ? ch : null;
    }

    private <T> CompletableFuture<T> notActive() {
        log.info("Client({}) request failed, connection is not active.", clientIdentifier());
        return CompletableFuture.failedFuture(new TransportException("connection is not active"));
    }

    int nextPacketIdentifier() {
        while (true) {
            int id = packetIdentifier.incrementAndGet() & 0xFFFF;
            if (id != 0 && !unAckPackets.containsKey(id)) {
                return id;
            }
        }
    }

    private CompletableFuture<Object> unAckPackets(int packetIdentifier) {
        CompletableFuture<Object> future = new CompletableFuture<>();
        if (unAckPackets.putIfAbsent(packetIdentifier, future) != null) {
            throw new IllegalStateException("packetIdentifier in use: " + packetIdentifier);
        }
        return future;
    }

    void ackPackets(int packetIdentifier, Object result) {
        CompletableFuture<Object> cf = unAckPackets.remove(packetIdentifier);
        if (cf != null) {
            cf.complete(result);
        }
        else {
            log.debug("Client({}) ack of unknown packetIdentifier: {}", clientIdentifier(), packetIdentifier);
        }
    }

    private void ackPacketsExceptionally(int packetIdentifier, Throwable cause) {
        CompletableFuture<Object> cf = unAckPackets.remove(packetIdentifier);
        if (cf != null) {
            cf.completeExceptionally(cause);
        }
    }

    private void failUnAckPackets(Throwable cause) {
        for (Integer id : new ArrayList<>(unAckPackets.keySet())) {
            ackPacketsExceptionally(id, cause);
        }
    }

    private ChannelFutureListener failOnWriteFailure(int packetIdentifier) {
        return f -> {
            if (!f.isSuccess()) {
                ackPacketsExceptionally(packetIdentifier, f.cause());
            }
        };
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    @Override
    public String clientIdentifier() {
        return options.getClientId();
    }

    @Override
    public ConnAck connAck() {
        return connAck;
    }

    @Override
    public boolean connected() {
        return connected;
    }

    @Override
    public boolean reconnecting() {
        return reconnecting;
    }

    int keepAlive() {
        return options.getKeepAlive();
    }

}
