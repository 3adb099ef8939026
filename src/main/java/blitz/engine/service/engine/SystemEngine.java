package blitz.engine.service.engine;

import blitz.engine.config.EngineMode;
import blitz.engine.dto.SystemClientCommand;
import blitz.engine.dto.SystemServerEvent;
import blitz.engine.model.SystemState;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SystemEngine implements Engine<SystemClientCommand, SystemServerEvent> {
    private final StateStore<SystemState> stateStore;
    private final EventBus<SystemServerEvent> eventBus;
    private final SystemCommandProcessor processor;

    @Override
    public EngineMode getMode() {
        return EngineMode.SYSTEM;
    }

    @Override
    public Class<SystemClientCommand> getCommandType() {
        return SystemClientCommand.class;
    }

    @Override
    public SystemState getState() {
        return stateStore.read();
    }

    @Override
    public EventBus<SystemServerEvent> getEventBus() {
        return eventBus;
    }

    @Override
    public EngineConnection<SystemServerEvent> connect() {
        return stateStore.computeWithLock(state ->
                new EngineConnection<>(new SystemServerEvent.StateChanged(state), eventBus.subscribe()));
    }

    @Override
    public void handle(SystemClientCommand command) {
        processor.handle(command);
    }
}
