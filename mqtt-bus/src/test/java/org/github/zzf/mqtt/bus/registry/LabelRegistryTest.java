package org.github.zzf.mqtt.bus.registry;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import org.github.zzf.mqtt.bus.MessageListener;
import org.github.zzf.mqtt.bus.exception.DuplicateLabelException;
import org.github.zzf.mqtt.bus.exception.InvalidPatternException;
import org.github.zzf.mqtt.bus.exception.UnknownLabelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LabelRegistryTest {

    LabelRegistry registry;

    @BeforeEach
    public void beforeEach() {
        registry = new LabelRegistry();
    }

    @Test
    void givenEmpty_whenRegister_thenLookup() {
        LabelEntry entry = registry.register("cfg", "devices/+deviceId/config/#keys");
        then(registry.lookup("cfg")).isSameAs(entry);
        then(registry.contains("cfg")).isTrue();
        then(registry.pattern("cfg").topicFilter()).isEqualTo("devices/+/config/#");
        then(entry.listenerCount()).isZero();
        then(entry.subscribed()).isFalse();
    }

    @Test
    void givenRegisteredLabel_whenRegisterAgain_thenException() {
        registry.register("cfg", "a/+x");
        thenThrownBy(() -> registry.register("cfg", "b/+y")).isInstanceOf(DuplicateLabelException.class);
        then(registry.pattern("cfg").pattern()).isEqualTo("a/+x");
    }

    @Test
    void givenInvalidPattern_whenRegister_thenNotRegistered() {
        thenThrownBy(() -> registry.register("cfg", "a/#x/b")).isInstanceOf(InvalidPatternException.class);
        then(registry.contains("cfg")).isFalse();
        then(registry.size()).isZero();
    }

    @Test
    void givenUnknownLabel_whenAnyLabelOperation_thenException() {
        MessageListener l = m -> {
        };
        thenThrownBy(() -> registry.lookup("x")).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.unregister("x")).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.addListener("x", l)).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.addOnceListener("x", l)).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.removeListener("x", l)).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.removeAllListeners("x")).isInstanceOf(UnknownLabelException.class);
        thenThrownBy(() -> registry.lookup(null)).isInstanceOf(UnknownLabelException.class);
    }

    @Test
    void givenLabels_whenEntries_thenRegistrationOrder() {
        registry.register("c", "c/+x");
        registry.register("a", "a/+x");
        registry.register("b", "b/+x");
        then(registry.entries()).extracting(LabelEntry::label).containsExactly("c", "a", "b");
        registry.unregister("a");
        registry.register("a", "a/+x");
        then(registry.entries()).extracting(LabelEntry::label).containsExactly("c", "b", "a");
    }

    @Test
    void givenListeners_whenUnregister_thenListenersCleared() {
        LabelEntry entry = registry.register("cfg", "a/+x");
        registry.addListener("cfg", m -> {
        });
        registry.addOnceListener("cfg", m -> {
        });
        then(entry.listenerCount()).isEqualTo(2);
        then(registry.unregister("cfg")).isSameAs(entry);
        then(entry.listenerCount()).isZero();
        then(registry.contains("cfg")).isFalse();
    }

    @Test
    void givenSameListenerTwice_whenRemoveListener_thenOneRegistrationRemoved() {
        LabelEntry entry = registry.register("cfg", "a/+x");
        MessageListener l = m -> {
        };
        registry.addListener("cfg", l);
        registry.addListener("cfg", l);
        then(entry.listenerCount()).isEqualTo(2);
        then(registry.removeListener("cfg", l)).isTrue();
        then(entry.listenerCount()).isEqualTo(1);
        then(registry.removeListener("cfg", l)).isTrue();
        then(registry.removeListener("cfg", l)).isFalse();
    }

    @Test
    void givenListenersOnTwoLabels_whenRemoveAllListeners_then() {
        LabelEntry a = registry.register("a", "a/+x");
        LabelEntry b = registry.register("b", "b/+x");
        registry.addListener("a", m -> {
        });
        registry.addListener("b", m -> {
        });
        registry.removeAllListeners("a");
        then(a.listenerCount()).isZero();
        then(b.listenerCount()).isEqualTo(1);
        registry.addListener("a", m -> {
        });
        registry.removeAllListeners();
        then(a.listenerCount()).isZero();
        then(b.listenerCount()).isZero();
        // labels survive
        then(registry.size()).isEqualTo(2);
    }

}
