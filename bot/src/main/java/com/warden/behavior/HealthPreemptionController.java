package com.warden.behavior;

import com.warden.config.BotConfig;
import com.warden.input.Action;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;
import com.warden.recovery.ErrorEvent;
import com.warden.recovery.ErrorEventSink;
import com.warden.recovery.ErrorKind;
import com.warden.recovery.ErrorSeverity;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.Observation;
import com.warden.state.ObservationPort;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import com.warden.status.EventSink;
import com.warden.timing.BoundedCall;
import com.warden.timing.DelayTimer;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Samples health on its own schedule and forces an emergency exit ("chicken") when it
 * drops to the floor.
 *
 * <p>Runs on a dedicated thread, independent of the loop's tick. Each check:
 * <ol>
 *   <li>reads health and mana from the observation port, bounded by
 *       {@code healthSampleTimeout};</li>
 *   <li>in the warning band, drinks a health potion (subject to the potion cooldown);</li>
 *   <li>at the floor, optionally drinks a rejuvenation potion and resamples, then issues a
 *       preemptive transition to {@link BotState#CHICKENED} and walks the exit strategies
 *       in order, each bounded by {@code exitAttemptTimeout}.</li>
 * </ol>
 *
 * <p>The controller never writes state: it only calls
 * {@link BotStateMachine#requestTransition}. A failed exit strategy is reported as a
 * run-ending {@link ErrorKind#EXIT_ATTEMPT_FAILED}; running out of strategies is a
 * critical {@link ErrorKind#EXIT_EXHAUSTED}. One chicken fires per stay in
 * {@code CHICKENED}.
 */
@Slf4j
@Singleton
public class HealthPreemptionController {

    private static final String ORIGIN = "health";

    private final BotConfig config;
    private final ObservationPort observationPort;
    private final BoundedCall boundedCall;
    private final ActionGateway actions;
    private final BotStateMachine stateMachine;
    private final ErrorEventSink errorSink;
    private final DelayTimer delayTimer;
    private final EventSink events;
    private final List<ExitStrategy> exitStrategies;

    private final int healthFloor;
    private final int manaFloor;
    private final int warningThreshold;

    private final Deque<HealthSample> samples = new ArrayDeque<>();
    private final List<ChickenEvent> chickenHistory = new CopyOnWriteArrayList<>();
    private final AtomicBoolean chickenLatched = new AtomicBoolean();

    @Nullable
    private ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private ScheduledFuture<?> task;
    private volatile boolean running;
    private volatile Instant lastPotionAt = Instant.EPOCH;

    @Inject
    public HealthPreemptionController(BotConfig config,
                                      ObservationPort observationPort,
                                      BoundedCall boundedCall,
                                      ActionGateway actions,
                                      BotStateMachine stateMachine,
                                      ErrorEventSink errorSink,
                                      DelayTimer delayTimer,
                                      @Nullable EventSink events) {
        this(config, observationPort, boundedCall, actions, stateMachine, errorSink, delayTimer, events,
                ExitStrategy.standard(config), null);
    }

    /**
     * Constructor for testing with explicit exit strategies and executor.
     */
    HealthPreemptionController(BotConfig config,
                               ObservationPort observationPort,
                               BoundedCall boundedCall,
                               ActionGateway actions,
                               BotStateMachine stateMachine,
                               ErrorEventSink errorSink,
                               DelayTimer delayTimer,
                               @Nullable EventSink events,
                               List<ExitStrategy> exitStrategies,
                               @Nullable ScheduledExecutorService executor) {
        this.config = config;
        this.observationPort = observationPort;
        this.boundedCall = boundedCall;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.errorSink = errorSink;
        this.delayTimer = delayTimer;
        this.events = events != null ? events : EventSink.NONE;
        this.exitStrategies = List.copyOf(exitStrategies);
        this.executor = executor;
        this.ownsExecutor = executor == null;
        this.healthFloor = config.getHealthFloorPercent();
        this.manaFloor = config.getManaFloorPercent();
        this.warningThreshold = config.getEffectiveHealthWarningPercent();
        log.info("HealthPreemptionController initialized (floor {}%, warning {}%, mana floor {}%)",
                healthFloor, warningThreshold, manaFloor);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    public synchronized void start() {
        if (running) {
            log.warn("Health controller already running");
            return;
        }
        if (executor == null || executor.isShutdown()) {
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "Warden-Health");
                t.setDaemon(true);
                return t;
            });
        }
        chickenLatched.set(false);
        long period = config.getHealthSampleInterval().toMillis();
        task = executor.scheduleWithFixedDelay(this::safeCheck, 0, period, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Health controller started (every {}ms)", period);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        if (ownsExecutor && executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        log.info("Health controller stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void safeCheck() {
        try {
            checkOnce();
        } catch (RuntimeException e) {
            // keep the schedule alive; a throwing task would be cancelled silently
            log.error("Health check failed", e);
        }
    }

    // ========================================================================
    // Checking
    // ========================================================================

    /**
     * Take one sample and respond to it.
     *
     * @return the status of the sample
     */
    public synchronized HealthStatus checkOnce() {
        BotState current = stateMachine.currentState();
        if (chickenLatched.get() && current != BotState.CHICKENED) {
            chickenLatched.set(false);
            log.debug("Left CHICKENED, chicken re-armed");
        }

        HealthSample sample = sample();
        switch (sample.getStatus()) {
            case CRITICAL:
                handleCritical(sample, current);
                break;
            case WARNING:
                handleWarning(sample, current);
                break;
            default:
                break;
        }
        return sample.getStatus();
    }

    /**
     * Band for a pair of readings. Missing health is {@link HealthStatus#UNKNOWN} unless
     * the mana floor is crossed.
     */
    public HealthStatus evaluate(@Nullable Double health, @Nullable Double mana) {
        if (manaFloor > 0 && mana != null && mana <= manaFloor) {
            return HealthStatus.CRITICAL;
        }
        if (health == null) {
            return HealthStatus.UNKNOWN;
        }
        if (health <= healthFloor) {
            return HealthStatus.CRITICAL;
        }
        if (health <= warningThreshold) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.SAFE;
    }

    private HealthSample sample() {
        Observation observation = null;
        try {
            observation = boundedCall.call(observationPort::observe, config.getHealthSampleTimeout());
        } catch (TimeoutException e) {
            log.debug("Health sample timed out after {}ms", config.getHealthSampleTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (BoundedCall.CallFailedException e) {
            log.debug("Health sample failed: {}", e.getMessage());
        }

        Double health = null;
        Double mana = null;
        if (observation != null) {
            health = boxed(observation.getHealthPercent());
            mana = boxed(observation.getManaPercent());
        }
        HealthSample sample = new HealthSample(health, mana, evaluate(health, mana), Instant.now());
        synchronized (samples) {
            samples.addLast(sample);
            while (samples.size() > config.getHealthSampleBufferSize()) {
                samples.removeFirst();
            }
        }
        return sample;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private void handleWarning(HealthSample sample, BotState current) {
        if (!current.isInGame() || chickenLatched.get()) {
            return;
        }
        log.debug("Health at {}% (warning {}%)", sample.getHealthPercent(), warningThreshold);
        drink(config.getHealthPotionKey(), "health potion");
    }

    private void handleCritical(HealthSample sample, BotState current) {
        if (chickenLatched.get()) {
            return;
        }
        if (!stateMachine.getGraph().contains(current, BotState.CHICKENED)) {
            log.debug("Critical reading in {}, no chicken from here", current);
            return;
        }

        log.warn("CRITICAL: health {}%, mana {}% (floor {}%)",
                sample.getHealthPercent(), sample.getManaPercent(), healthFloor);

        boolean potionAttempted = false;
        if (config.isRejuvBeforeChicken()) {
            potionAttempted = drink(config.getRejuvPotionKey(), "rejuvenation potion");
            if (potionAttempted) {
                delayTimer.sleep(config.getRejuvSettleDelay());
                HealthSample after = sample();
                if (after.getStatus() == HealthStatus.SAFE || after.getStatus() == HealthStatus.WARNING) {
                    log.info("Rejuvenation brought health back to {}%", after.getHealthPercent());
                    return;
                }
                if (after.getStatus() == HealthStatus.CRITICAL) {
                    sample = after;
                } else {
                    log.warn("No health reading after rejuvenation, chickening on the last one");
                }
            }
        }

        chicken(sample, potionAttempted ? "health critical after rejuvenation" : "health critical",
                potionAttempted);
    }

    private boolean drink(String key, String label) {
        Instant now = Instant.now();
        if (Duration.between(lastPotionAt, now).compareTo(config.getPotionCooldown()) < 0) {
            return false;
        }
        ActionResult result = actions.perform(Action.potion(key, label));
        if (!result.isOk()) {
            log.warn("Could not use {}: {}", label, result.getMessage());
            return false;
        }
        lastPotionAt = now;
        log.info("Used {} (slot {})", label, key);
        return true;
    }

    // ========================================================================
    // Chicken
    // ========================================================================

    /**
     * Force an emergency exit now, regardless of the last reading.
     *
     * @param reason why, for the record
     * @return true if the chicken fired
     */
    public synchronized boolean chicken(String reason) {
        HealthSample last = getLastSample();
        HealthSample sample = last != null ? last
                : new HealthSample(null, null, HealthStatus.UNKNOWN, Instant.now());
        return chicken(sample, reason, false);
    }

    private boolean chicken(HealthSample sample, String reason, boolean potionAttempted) {
        if (!chickenLatched.compareAndSet(false, true)) {
            return false;
        }
        BotState from = stateMachine.currentState();
        TransitionResult result = stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, ORIGIN);
        if (result.isRejected()) {
            chickenLatched.set(false);
            log.warn("Chicken transition from {} rejected: {}", from, result.getRejection());
            return false;
        }
        log.warn("CHICKEN from {}: {}", from, reason);

        String exitUsed = leaveGame();
        ChickenEvent event = ChickenEvent.builder()
                .healthPercent(sample.getHealthPercent())
                .manaPercent(sample.getManaPercent())
                .reason(reason)
                .fromState(from)
                .potionAttempted(potionAttempted)
                .exitStrategy(exitUsed)
                .build();
        chickenHistory.add(event);
        try {
            events.onChicken(event);
        } catch (RuntimeException e) {
            log.error("Event sink failed for {}", event, e);
        }
        return true;
    }

    @Nullable
    private String leaveGame() {
        Duration timeout = config.getExitAttemptTimeout();
        for (ExitStrategy strategy : exitStrategies) {
            ActionResult result;
            try {
                result = strategy.attempt(actions, timeout);
            } catch (RuntimeException e) {
                log.error("Exit strategy {} threw", strategy.getName(), e);
                result = ActionResult.failed(String.valueOf(e.getMessage()));
            }
            if (result.isOk()) {
                log.info("Left game via {}", strategy.getName());
                return strategy.getName();
            }
            log.warn("Exit via {} failed: {}", strategy.getName(), result.getMessage());
            errorSink.report(ErrorEvent.of(ErrorKind.EXIT_ATTEMPT_FAILED, BotState.CHICKENED,
                    ErrorSeverity.RUN_ENDING, strategy.getName() + ": " + result.getMessage()));
        }
        log.error("All {} exit strategies failed", exitStrategies.size());
        errorSink.report(ErrorEvent.of(ErrorKind.EXIT_EXHAUSTED, BotState.CHICKENED,
                ErrorSeverity.CRITICAL, "all exit strategies failed"));
        return null;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Nullable
    public HealthSample getLastSample() {
        synchronized (samples) {
            return samples.peekLast();
        }
    }

    public List<HealthSample> getSamples() {
        synchronized (samples) {
            return new ArrayList<>(samples);
        }
    }

    public HealthStatus getLastStatus() {
        HealthSample last = getLastSample();
        return last == null ? HealthStatus.UNKNOWN : last.getStatus();
    }

    public List<ChickenEvent> getChickenHistory() {
        return List.copyOf(chickenHistory);
    }

    public int getChickenCount() {
        return chickenHistory.size();
    }

    public boolean isChickenLatched() {
        return chickenLatched.get();
    }

    public int getWarningThreshold() {
        return warningThreshold;
    }

    @Override
    public String toString() {
        return String.format("HealthPreemptionController[running=%s, last=%s, chickens=%d]",
                running, getLastStatus(), chickenHistory.size());
    }
}
