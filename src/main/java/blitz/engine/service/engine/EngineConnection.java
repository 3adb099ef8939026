package blitz.engine.service.engine;

/**
 * A new observer's view of an engine: the state at subscription time, already
 * wrapped as a state-changed event, and the subscription that continues from it.
 */
public record EngineConnection<E>(E snapshot, Subscription<E> subscription) {
}
