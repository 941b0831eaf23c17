package org.github.zzf.mqtt.bus;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.exception.AlreadyAvailableException;
import org.github.zzf.mqtt.bus.exception.AlreadySubscribedException;
import org.github.zzf.mqtt.bus.exception.NotAvailableException;
import org.github.zzf.mqtt.bus.exception.NotSubscribedException;
import org.github.zzf.mqtt.bus.exception.ParameterCountMismatchException;
import org.github.zzf.mqtt.bus.pattern.TopicPattern;
import org.github.zzf.mqtt.bus.registry.Dispatcher;
import org.github.zzf.mqtt.bus.registry.LabelEntry;
import org.github.zzf.mqtt.bus.registry.LabelRegistry;
import org.github.zzf.mqtt.bus.state.ConnectionStateMachine;
import org.github.zzf.mqtt.bus.state.Status;
import org.github.zzf.mqtt.bus.state.StatusListener;
import org.github.zzf.mqtt.bus.transport.ConnAck;
import org.github.zzf.mqtt.bus.transport.InboundMessage;
import org.github.zzf.mqtt.bus.transport.Transport;
import org.github.zzf.mqtt.bus.transport.TransportConnection;
import org.github.zzf.mqtt.bus.transport.TransportListener;
import org.github.zzf.mqtt.bus.transport.netty.NettyTransport;

/**
 * Subscribe, publish and receive by label instead of by Topic.
 * <pre>
 *     Bus bus = Bus.create("client1", "mqtt://localhost:1883", new BusOptions());
 *     bus.setPattern("cfg", "devices/+deviceId/config/#keys");
 *     bus.on("cfg", m -&gt; log.info("{} -&gt; {}", m.param("deviceId"), m.paramList("keys")));
 *     bus.connect()
 *         .thenCompose(connAck -&gt; bus.subscribe("cfg"))
 *         .thenCompose(granted -&gt; bus.publish("cfg", Map.of("deviceId", "d1", "keys", List.of("http")), "on"));
 * </pre>
 * <p>Every method and every event of the connection is serialized on one lock. Listeners and the status
 * observer are invoked while holding it and may call back into the bus.</p>
 */
@Slf4j
public class Bus {

    private final Transport transport;
    private final BusOptions options;

    private final Object lock = new Object();
    private final ConnectionStateMachine state = new ConnectionStateMachine();
    private final LabelRegistry registry = new LabelRegistry();
    private final Dispatcher dispatcher = new Dispatcher(registry);
    // Topic Filters subscribed on the current connection
    private final Set<String> subscriptionTopics = new LinkedHashSet<>();

    @Nullable
    private TransportConnection connection;

    public Bus(String url, BusOptions options) {
        this(new NettyTransport(), options.copy().setUrl(url));
    }

    public Bus(Transport transport, BusOptions options) {
        this.transport = checkNotNull(transport, "transport");
        this.options = checkNotNull(options, "options").copy();
    }

    public static Bus create(String clientId, String url, BusOptions options) {
        return new Bus(url, options.copy().setClientId(clientId));
    }

    /**
     * @return true if connected or reconnecting
     */
    public boolean isAvailable() {
        synchronized (lock) {
            return connection != null && (connection.connected() || connection.reconnecting());
        }
    }

    /**
     * connect to the broker
     *
     * @return the CONNACK; fails with {@link AlreadyAvailableException} or with the error of the transport
     */
    public CompletionStage<ConnAck> connect() {
        CompletableFuture<ConnAck> result = new CompletableFuture<>();
        synchronized (lock) {
            if (isAvailable()) {
                return CompletableFuture.failedFuture(new AlreadyAvailableException());
            }
            if (state.status() == Status.CONNECTING) {
                return CompletableFuture.failedFuture(new IllegalStateException("connect already in progress"));
            }
            if (state.status() != Status.READY) {
                reset();
            }
            log.info("Bus({}) connecting to {}", id(), options.getUrl());
            transition(Status.CONNECTING, null);
        }
        transport.connect(options.copy()).whenComplete((conn, t) -> {
            synchronized (lock) {
                if (t != null) {
                    Throwable cause = unwrap(t);
                    log.warn("Bus({}) connect failed", id(), cause);
                    connection = null;
                    transition(Status.ERROR, cause);
                    result.completeExceptionally(cause);
                    return;
                }
                connection = conn;
                conn.listener(new ConnectionListener(conn));
                log.info("Bus({}) connected: {}", id(), conn.connAck());
                transition(Status.CONNECTED, null);
                result.complete(conn.connAck());
            }
        });
        return result;
    }

    public CompletionStage<Void> end() {
        return end(false);
    }

    /**
     * close the connection, then reset status and subscriptions. Labels and listeners are kept.
     *
     * @param force don't wait for in-flight messages to be acknowledged
     */
    public CompletionStage<Void> end(boolean force) {
        TransportConnection conn;
        synchronized (lock) {
            if (!isAvailable()) {
                return CompletableFuture.failedFuture(new NotAvailableException());
            }
            conn = connection;
        }
        log.info("Bus({}) end, force: {}", id(), force);
        return conn.end(force).thenRun(() -> {
            synchronized (lock) {
                if (connection == conn) {
                    connection = null;
                    reset();
                }
            }
        });
    }

    public CompletionStage<List<Integer>> subscribe(String label) {
        return subscribe(label, new SubscribeOptions());
    }

    /**
     * subscribe to the Topic Filter of the label's pattern
     *
     * @return the granted QoS
     */
    public CompletionStage<List<Integer>> subscribe(String label, SubscribeOptions subscribeOptions) {
        TransportConnection conn;
        LabelEntry entry;
        String topicFilter;
        synchronized (lock) {
            try {
                conn = availableConnection();
                entry = registry.lookup(label);
                topicFilter = entry.pattern().topicFilter();
                if (subscriptionTopics.contains(topicFilter)) {
                    throw new AlreadySubscribedException(topicFilter);
                }
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        log.debug("Bus({}) subscribe label({}) -> {}", id(), label, topicFilter);
        return conn.subscribe(topicFilter, subscribeOptions.getQos()).thenApply(granted -> {
            synchronized (lock) {
                subscriptionTopics.add(topicFilter);
                entry.subscribed(true);
            }
            return granted;
        });
    }

    public CompletionStage<Void> unsubscribe(String label) {
        return unsubscribe(label, false);
    }

    /**
     * @param removeListeners also remove all listeners of the label
     */
    public CompletionStage<Void> unsubscribe(String label, boolean removeListeners) {
        TransportConnection conn;
        LabelEntry entry;
        String topicFilter;
        synchronized (lock) {
            try {
                conn = availableConnection();
                entry = registry.lookup(label);
                topicFilter = entry.pattern().topicFilter();
                if (!subscriptionTopics.contains(topicFilter)) {
                    throw new NotSubscribedException(topicFilter);
                }
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        log.debug("Bus({}) unsubscribe label({}) -> {}", id(), label, topicFilter);
        return conn.unsubscribe(topicFilter).thenRun(() -> {
            synchronized (lock) {
                subscriptionTopics.remove(topicFilter);
                entry.subscribed(false);
                if (removeListeners && registry.contains(label)) {
                    registry.removeAllListeners(label);
                }
            }
        });
    }

    public CompletionStage<Void> publish(String label, Map<String, ?> params, String payload) {
        return publish(label, params, payload.getBytes(UTF_8), new PublishOptions());
    }

    public CompletionStage<Void> publish(String label, Map<String, ?> params, String payload,
        PublishOptions publishOptions) {
        return publish(label, params, payload.getBytes(UTF_8), publishOptions);
    }

    public CompletionStage<Void> publish(String label, Map<String, ?> params, byte[] payload) {
        return publish(label, params, payload, new PublishOptions());
    }

    /**
     * publish to the Topic built from the label's pattern and the params
     *
     * @param params parameter values, see {@link TopicPattern#buildTopic(Map)}
     */
    public CompletionStage<Void> publish(String label, Map<String, ?> params, byte[] payload,
        PublishOptions publishOptions) {
        TransportConnection conn;
        String topic;
        synchronized (lock) {
            try {
                conn = availableConnection();
                TopicPattern pattern = registry.pattern(label);
                Map<String, ?> values = params == null ? Map.of() : params;
                if (values.size() != pattern.parameterCount()) {
                    throw new ParameterCountMismatchException(pattern.parameterCount(), values.size());
                }
                topic = pattern.buildTopic(values);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        log.debug("Bus({}) publish label({}) -> {}", id(), label, topic);
        return conn.publish(topic, checkNotNull(payload, "payload"), publishOptions.getQos(), publishOptions.isRetain());
    }

    /**
     * register a pattern under a label
     *
     * @throws org.github.zzf.mqtt.bus.exception.DuplicateLabelException if the label is in use
     * @throws org.github.zzf.mqtt.bus.exception.InvalidPatternException if the pattern is malformed
     */
    public void setPattern(String label, String pattern) {
        synchronized (lock) {
            registry.register(label, pattern);
        }
    }

    /**
     * remove the label with its listeners, unsubscribing first if it is subscribed
     *
     * @throws org.github.zzf.mqtt.bus.exception.UnknownLabelException if the label is not registered
     */
    public void removePattern(String label) {
        synchronized (lock) {
            LabelEntry entry = registry.lookup(label);
            String topicFilter = entry.pattern().topicFilter();
            if (entry.subscribed() && subscriptionTopics.remove(topicFilter) && connection != null) {
                connection.unsubscribe(topicFilter).whenComplete((v, t) -> {
                    if (t != null) {
                        log.warn("Bus({}) unsubscribe {} of removed label({}) failed", id(), topicFilter, label, t);
                    }
                });
            }
            registry.unregister(label);
        }
    }

    public void on(String label, MessageListener listener) {
        synchronized (lock) {
            registry.addListener(label, listener);
        }
    }

    /**
     * the listener receives at most one message
     */
    public void once(String label, MessageListener listener) {
        synchronized (lock) {
            registry.addOnceListener(label, listener);
        }
    }

    public boolean removeListener(String label, MessageListener listener) {
        synchronized (lock) {
            return registry.removeListener(label, listener);
        }
    }

    public void removeAllListeners(String label) {
        synchronized (lock) {
            registry.removeAllListeners(label);
        }
    }

    public void removeAllListeners() {
        synchronized (lock) {
            registry.removeAllListeners();
        }
    }

    /**
     * set the observer of status changes, replacing the previous one. null removes it.
     */
    public void onStatusChange(@Nullable StatusListener observer) {
        synchronized (lock) {
            state.observer(observer);
        }
    }

    public Status status() {
        synchronized (lock) {
            return state.status();
        }
    }

    /**
     * @return the last error, kept until the next reset
     */
    @Nullable
    public Throwable statusError() {
        synchronized (lock) {
            return state.lastError();
        }
    }

    public String id() {
        return options.getClientId();
    }

    /**
     * @return the Topic Filters subscribed on the current connection
     */
    public Set<String> subscribedTopics() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(subscriptionTopics));
        }
    }

    private TransportConnection availableConnection() {
        if (!isAvailable()) {
            throw new NotAvailableException();
        }
        return connection;
    }

    /**
     * READY, no subscriptions and no connection. Labels and listeners are kept.
     */
    private void reset() {
        log.debug("Bus({}) reset", id());
        TransportConnection old = connection;
        connection = null;
        if (old != null) {
            old.end(true).whenComplete((v, t) -> {
                if (t != null) {
                    log.warn("Bus({}) end of the previous connection failed", id(), t);
                }
            });
        }
        state.reset();
        subscriptionTopics.clear();
        for (LabelEntry e : registry.entries()) {
            e.subscribed(false);
        }
    }

    /**
     * an exception of the status observer is logged, the new status is kept
     */
    private void transition(Status status, @Nullable Throwable cause) {
        try {
            state.transition(status, cause);
        } catch (RuntimeException e) {
            log.error("Bus({}) status observer failed on {}", id(), status, e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        if ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    private class ConnectionListener implements TransportListener {

        private final TransportConnection conn;

        ConnectionListener(TransportConnection conn) {
            this.conn = conn;
        }

        @Override
        public void onConnect() {
            transition(Status.CONNECTED, null);
        }

        @Override
        public void onReconnect() {
            transition(Status.RECONNECTING, null);
        }

        @Override
        public void onOffline() {
            transition(Status.OFFLINE, null);
        }

        @Override
        public void onClose() {
            transition(Status.CLOSED, null);
        }

        @Override
        public void onError(Throwable cause) {
            log.warn("Bus({}) connection error", id(), cause);
            transition(Status.ERROR, cause);
        }

        @Override
        public void onMessage(InboundMessage message) {
            synchronized (lock) {
                if (connection != conn) {
                    return;
                }
                dispatcher.dispatch(message);
            }
        }

        private void transition(Status status, @Nullable Throwable cause) {
            synchronized (lock) {
                if (connection != conn) {
                    log.debug("Bus({}) event of a stale connection ignored: {}", id(), status);
                    return;
                }
                log.info("Bus({}) connection status -> {}", id(), status);
                Bus.this.transition(status, cause);
            }
        }

    }

}
