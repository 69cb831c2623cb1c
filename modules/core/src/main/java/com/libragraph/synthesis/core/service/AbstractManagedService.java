package com.libragraph.synthesis.core.service;

import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for {@link ManagedService} implementations: an atomic state machine that logs every
 * transition and publishes it as a {@link ServiceStateChangedEvent}.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}. Start and stop are idempotent.
 * When constructed outside CDI no event is fired.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return;
        }
        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }
        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        if (state.get() == State.FAILED) {
            return;
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), state.get(), cause.getMessage());
        transition(State.FAILED);
    }

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        if (stateEvent != null) {
            stateEvent.fire(new ServiceStateChangedEvent(serviceId(), old, newState, Instant.now()));
        }
    }
}
