package blitz.engine.service.engine;

import blitz.engine.config.EngineMode;

/**
 * One running engine: a state store, the event bus its observers subscribe to and
 * the command processor that mutates the state.
 *
 * @param <C> the inbound command type
 * @param <E> the outbound event type
 */
public interface Engine<C, E> {

    EngineMode getMode();

    Class<C> getCommandType();

    /**
     * Current state, without taking the lock.
     */
    Object getState();

    EventBus<E> getEventBus();

    /**
     * Snapshots the state and subscribes to the bus in one atomic step, so the
     * snapshot is followed by exactly the events published after it.
     */
    EngineConnection<E> connect();

    void handle(C command);
}
