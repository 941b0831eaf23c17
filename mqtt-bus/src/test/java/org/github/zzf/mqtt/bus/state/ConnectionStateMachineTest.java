package org.github.zzf.mqtt.bus.state;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionStateMachineTest {

    @Test
    void givenNew_whenStatus_thenReady() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        then(sm.status()).isEqualTo(Status.READY);
        then(sm.lastError()).isNull();
    }

    @Test
    void givenError_whenTransitionWithoutError_thenLastErrorSticks() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        Exception e = new Exception("broken pipe");
        sm.transition(Status.CONNECTING);
        sm.transition(Status.ERROR, e);
        sm.transition(Status.CONNECTED);
        then(sm.status()).isEqualTo(Status.CONNECTED);
        then(sm.lastError()).isSameAs(e);
    }

    @Test
    void givenError_whenNewError_thenOverwritten() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        Exception e1 = new Exception("1");
        Exception e2 = new Exception("2");
        sm.transition(Status.ERROR, e1);
        sm.transition(Status.ERROR, e2);
        then(sm.lastError()).isSameAs(e2);
    }

    @Test
    void givenError_whenReset_thenReadyAndNoError() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        sm.transition(Status.ERROR, new Exception());
        sm.reset();
        then(sm.status()).isEqualTo(Status.READY);
        then(sm.lastError()).isNull();
    }

    @Test
    void givenObserver_whenTransition_thenNotifiedSynchronously() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        List<String> events = new ArrayList<>();
        sm.observer((status, error) -> events.add(status + ":" + (error == null ? "" : error.getMessage())));
        sm.transition(Status.CONNECTING);
        sm.transition(Status.ERROR, new Exception("refused"));
        then(events).containsExactly("CONNECTING:", "ERROR:refused");
    }

    @Test
    void givenTwoObservers_whenTransition_thenOnlyLastNotified() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        List<Status> first = new ArrayList<>();
        List<Status> second = new ArrayList<>();
        sm.observer((status, error) -> first.add(status));
        sm.observer((status, error) -> second.add(status));
        sm.transition(Status.CONNECTING);
        then(first).isEmpty();
        then(second).containsExactly(Status.CONNECTING);
        sm.observer(null);
        sm.transition(Status.CONNECTED);
        then(second).containsExactly(Status.CONNECTING);
    }

    @Test
    void givenFailingObserver_whenTransition_thenExceptionPropagatesAndStatusRecorded() {
        ConnectionStateMachine sm = new ConnectionStateMachine();
        sm.observer((status, error) -> {
            throw new IllegalStateException("observer failed");
        });
        thenThrownBy(() -> sm.transition(Status.CONNECTING)).isInstanceOf(IllegalStateException.class);
        then(sm.status()).isEqualTo(Status.CONNECTING);
    }

}
