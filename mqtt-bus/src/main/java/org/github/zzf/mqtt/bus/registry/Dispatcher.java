package org.github.zzf.mqtt.bus.registry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.Message;
import org.github.zzf.mqtt.bus.pattern.TopicMatch;
import org.github.zzf.mqtt.bus.pattern.TopicPattern;
import org.github.zzf.mqtt.bus.transport.InboundMessage;

/**
 * Routes a received message to the listeners of the first label, in registration order, whose pattern
 * matches the topic. A topic never fans out to a second label. Unmatched messages are dropped.
 */
@Slf4j
public class Dispatcher {

    private final LabelRegistry registry;

    private final Counter dispatched;
    private final Counter dropped;

    public Dispatcher(LabelRegistry registry) {
        this(registry, Metrics.globalRegistry);
    }

    public Dispatcher(LabelRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.dispatched = Counter.builder("mqtt.bus.message").tag("result", "dispatched").register(meterRegistry);
        this.dropped = Counter.builder("mqtt.bus.message").tag("result", "dropped").register(meterRegistry);
    }

    /**
     * @return the message handed to the listeners, empty if no label matched
     */
    public Optional<Message> dispatch(InboundMessage inbound) {
        for (LabelEntry entry : registry.entries()) {
            TopicPattern pattern = entry.pattern();
            Optional<TopicMatch> match = pattern.match(inbound.topicName());
            if (match.isPresent()) {
                Map<String, Object> params = pattern.extractParameters(match.get());
                Message message = new Message(entry.label(), inbound, params);
                log.debug("dispatch: {}", message);
                invokeListeners(entry, message);
                dispatched.increment();
                return Optional.of(message);
            }
        }
        log.debug("dispatch: no label matches, drop it: {}", inbound);
        dropped.increment();
        return Optional.empty();
    }

    private void invokeListeners(LabelEntry entry, Message message) {
        for (LabelEntry.Registration r : entry.snapshot()) {
            if (!entry.fire(r)) {
                continue;
            }
            try {
                r.listener.onMessage(message);
            } catch (RuntimeException e) {
                log.error("label({}) listener failed on message: {}", entry.label(), message, e);
            }
        }
    }

}
