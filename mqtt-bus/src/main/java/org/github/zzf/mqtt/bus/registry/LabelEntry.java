package org.github.zzf.mqtt.bus.registry;

import java.util.ArrayList;
import java.util.List;
import org.github.zzf.mqtt.bus.MessageListener;
import org.github.zzf.mqtt.bus.pattern.TopicPattern;

/**
 * A label, its pattern and the listeners registered for it.
 */
public class LabelEntry {

    private final String label;
    private final TopicPattern pattern;
    private final List<Registration> listeners = new ArrayList<>(2);
    private boolean subscribed;

    LabelEntry(String label, TopicPattern pattern) {
        this.label = label;
        this.pattern = pattern;
    }

    public String label() {
        return label;
    }

    public TopicPattern pattern() {
        return pattern;
    }

    public boolean subscribed() {
        return subscribed;
    }

    public void subscribed(boolean subscribed) {
        this.subscribed = subscribed;
    }

    public int listenerCount() {
        return listeners.size();
    }

    void add(MessageListener listener, boolean once) {
        listeners.add(new Registration(listener, once));
    }

    /**
     * remove the most recently added registration of the listener
     */
    boolean remove(MessageListener listener) {
        for (int i = listeners.size() - 1; i >= 0; i--) {
            if (listeners.get(i).listener == listener) {
                listeners.remove(i);
                return true;
            }
        }
        return false;
    }

    void clear() {
        listeners.clear();
    }

    /**
     * @return a copy, listeners may be added or removed while the copy is iterated
     */
    List<Registration> snapshot() {
        return new ArrayList<>(listeners);
    }

    /**
     * detach a once registration before it is invoked
     *
     * @return false if it already fired
     */
    boolean fire(Registration r) {
        if (r.once) {
            if (r.fired) {
                return false;
            }
            r.fired = true;
            listeners.remove(r);
        }
        return true;
    }

    @Override
    public String toString() {
        return "{\"label\":\"" + label + "\",\"pattern\":\"" + pattern + "\",\"listeners\":" + listeners.size()
            + ",\"subscribed\":" + subscribed + "}";
    }

    // identity equality: the same listener may be registered more than once
    static final class Registration {

        final MessageListener listener;
        final boolean once;
        boolean fired;

        Registration(MessageListener listener, boolean once) {
            this.listener = listener;
            this.once = once;
        }

    }

}
