package org.github.zzf.mqtt.bus.registry;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqtt.bus.MessageListener;
import org.github.zzf.mqtt.bus.exception.DuplicateLabelException;
import org.github.zzf.mqtt.bus.exception.UnknownLabelException;
import org.github.zzf.mqtt.bus.pattern.TopicPattern;

/**
 * label -> {@link LabelEntry}, iterated in registration order.
 * <p>The order decides which label receives a message when several patterns match the same topic.</p>
 * <p>Not thread-safe.</p>
 */
@Slf4j
public class LabelRegistry {

    private final Map<String, LabelEntry> entries = new LinkedHashMap<>();

    /**
     * @throws DuplicateLabelException if the label is in use
     * @throws org.github.zzf.mqtt.bus.exception.InvalidPatternException if the pattern is malformed
     */
    public LabelEntry register(String label, String pattern) {
        checkNotNull(label, "label");
        if (entries.containsKey(label)) {
            throw new DuplicateLabelException(label);
        }
        LabelEntry entry = new LabelEntry(label, TopicPattern.compile(pattern));
        entries.put(label, entry);
        log.debug("label registered: {}", entry);
        return entry;
    }

    /**
     * remove the label and all its listeners
     *
     * @return the removed entry
     */
    public LabelEntry unregister(String label) {
        LabelEntry entry = entries.remove(lookupKey(label));
        entry.clear();
        log.debug("label unregistered: {}", entry);
        return entry;
    }

    /**
     * @throws UnknownLabelException if the label is not registered
     */
    public LabelEntry lookup(String label) {
        return entries.get(lookupKey(label));
    }

    public TopicPattern pattern(String label) {
        return lookup(label).pattern();
    }

    public boolean contains(String label) {
        return entries.containsKey(label);
    }

    /**
     * @return the entries in registration order
     */
    public Collection<LabelEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public void addListener(String label, MessageListener listener) {
        lookup(label).add(checkNotNull(listener, "listener"), false);
    }

    /**
     * the listener is removed before its first invocation
     */
    public void addOnceListener(String label, MessageListener listener) {
        lookup(label).add(checkNotNull(listener, "listener"), true);
    }

    /**
     * remove the most recently added registration of the listener
     *
     * @return true if a registration was removed
     */
    public boolean removeListener(String label, MessageListener listener) {
        return lookup(label).remove(listener);
    }

    public void removeAllListeners(String label) {
        lookup(label).clear();
    }

    public void removeAllListeners() {
        entries.values().forEach(LabelEntry::clear);
    }

    private String lookupKey(String label) {
        if (label == null || !entries.containsKey(label)) {
            throw new UnknownLabelException(label);
        }
        return label;
    }

}
