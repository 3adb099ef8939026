package blitz.engine.service.engine;

import blitz.engine.config.EngineMode;
import blitz.engine.dto.ClientCommand;
import blitz.engine.dto.ServerEvent;
import blitz.engine.model.InstallState;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InstallEngine implements Engine<ClientCommand, ServerEvent> {
    private final StateStore<InstallState> stateStore;
    private final EventBus<ServerEvent> eventBus;
    private final InstallCommandProcessor processor;

    @Override
    public EngineMode getMode() {
        return EngineMode.INSTALL;
    }

    @Override
    public Class<ClientCommand> getCommandType() {
        return ClientCommand.class;
    }

    @Override
    public InstallState getState() {
        return stateStore.read();
    }

    @Override
    public EventBus<ServerEvent> getEventBus() {
        return eventBus;
    }

    @Override
    public EngineConnection<ServerEvent> connect() {
        return stateStore.computeWithLock(state ->
                new EngineConnection<>(new ServerEvent.StateChanged(state), eventBus.subscribe()));
    }

    @Override
    public void handle(ClientCommand command) {
        processor.handle(command);
    }
}
