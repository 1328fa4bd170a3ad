package com.warden.core;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.warden.config.BotConfig;
import com.warden.input.ActionGateway;
import com.warden.input.ActionPort;
import com.warden.recovery.ErrorEventSink;
import com.warden.recovery.RecoveryCoordinator;
import com.warden.recovery.SeverityTable;
import com.warden.recovery.actions.DefaultRecoveryActions;
import com.warden.state.BotStateMachine;
import com.warden.state.ObservationPort;
import com.warden.state.TransitionGraph;
import com.warden.status.AsyncEventSink;
import com.warden.status.EventSink;
import com.warden.status.LoggingEventSink;
import com.warden.status.SessionTracker;
import com.warden.timing.DelayTimer;
import com.warden.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Guice module for the engine.
 *
 * <p>Binds the two external ports and the optional process probe, and provides the
 * pieces that are built from configuration. Everything else is {@code @Singleton}
 * annotated on the class itself.
 */
@Slf4j
public class WardenModule extends AbstractModule {

    private final BotConfig config;
    private final ObservationPort observationPort;
    private final ActionPort actionPort;
    @Nullable
    private final GameProcessProbe processProbe;

    public WardenModule(BotConfig config, ObservationPort observationPort, ActionPort actionPort,
                        @Nullable GameProcessProbe processProbe) {
        this.config = config;
        this.observationPort = observationPort;
        this.actionPort = actionPort;
        this.processProbe = processProbe;
    }

    @Override
    protected void configure() {
        bind(BotConfig.class).toInstance(config);
        bind(ObservationPort.class).toInstance(observationPort);
        bind(ActionPort.class).toInstance(actionPort);
        bind(ErrorEventSink.class).to(RecoveryCoordinator.class);
    }

    @Provides
    @Nullable
    public GameProcessProbe provideProcessProbe() {
        return processProbe;
    }

    @Provides
    @Singleton
    public TransitionGraph provideTransitionGraph(BotConfig config) {
        TransitionGraph graph = TransitionGraph.standard(config);
        log.debug("Transition graph: {} edges", graph.edgeCount());
        return graph;
    }

    @Provides
    @Singleton
    public SeverityTable provideSeverityTable(BotConfig config) {
        return SeverityTable.fromConfig(config);
    }

    /**
     * Events are logged and counted on a background thread.
     */
    @Provides
    @Singleton
    public EventSink provideEventSink(SessionTracker tracker) {
        return new AsyncEventSink(List.of(new LoggingEventSink(), tracker));
    }

    /**
     * The coordinator comes with the default recovery for every recoverable kind.
     */
    @Provides
    @Singleton
    public RecoveryCoordinator provideRecoveryCoordinator(SeverityTable severityTable,
                                                          BotConfig config,
                                                          BotStateMachine stateMachine,
                                                          ActionGateway actions,
                                                          EventSink events,
                                                          Randomization randomization,
                                                          DelayTimer delayTimer) {
        RecoveryCoordinator coordinator = new RecoveryCoordinator(severityTable, config, stateMachine, actions, events);
        DefaultRecoveryActions.install(coordinator, randomization, delayTimer);
        return coordinator;
    }
}
