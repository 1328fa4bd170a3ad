package com.warden.recovery;

import com.warden.config.BotConfig;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.PositionSample;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Flags "no progress" over a sliding window of position or activity samples.
 *
 * <p>The window holds the last {@code windowSize} samples. {@link #isStuck()} is true only
 * when the window is full and every pair of samples is similar: within {@code epsilon}
 * on each axis, or carrying the same activity marker. A positive result emits a
 * {@link ErrorKind#STUCK} event and clears the window, so the same stale samples cannot
 * flag twice.
 *
 * <p>Single writer: fed and queried from the loop thread only.
 */
@Slf4j
public class StuckDetector {

    private final int windowSize;
    private final double epsilon;
    @Nullable
    private final ErrorEventSink sink;
    private final Supplier<BotState> originState;

    private final Deque<PositionSample> window = new ArrayDeque<>();
    private long detections;

    @Inject
    public StuckDetector(BotConfig config, ErrorEventSink sink, BotStateMachine stateMachine) {
        this(config.getStuckWindowSize(), config.getStuckEpsilon(), sink, stateMachine::currentState);
    }

    /**
     * @param windowSize  samples needed before a verdict
     * @param epsilon     max per-axis distance for two positions to count as the same
     * @param sink        where stuck events go; null to only return the flag
     * @param originState state recorded on emitted events
     */
    public StuckDetector(int windowSize, double epsilon, @Nullable ErrorEventSink sink,
                         Supplier<BotState> originState) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2, was " + windowSize);
        }
        this.windowSize = windowSize;
        this.epsilon = epsilon;
        this.sink = sink;
        this.originState = originState;
    }

    /**
     * Append a sample, evicting the oldest once the window is full.
     */
    public void observe(PositionSample sample) {
        window.addLast(sample);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    /**
     * Whether the full window shows no progress. Emits a stuck event and clears the
     * window when true.
     */
    public boolean isStuck() {
        if (window.size() < windowSize) {
            return false;
        }
        List<PositionSample> samples = new ArrayList<>(window);
        for (int i = 0; i < samples.size(); i++) {
            for (int j = i + 1; j < samples.size(); j++) {
                if (!samples.get(i).isSimilarTo(samples.get(j), epsilon)) {
                    return false;
                }
            }
        }

        detections++;
        PositionSample reference = samples.get(0);
        String where = reference.isPositional()
                ? String.format("~(%.0f, %.0f)", reference.getX(), reference.getY())
                : "activity '" + reference.getActivity() + "'";
        log.warn("Stuck: {} for {} samples", where, windowSize);
        window.clear();

        if (sink != null) {
            sink.report(ErrorEvent.of(ErrorKind.STUCK, originState.get(), ErrorSeverity.RECOVERABLE,
                    "no progress at " + where + " over " + windowSize + " samples"));
        }
        return true;
    }

    public boolean isWindowFull() {
        return window.size() >= windowSize;
    }

    public int getSampleCount() {
        return window.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public long getDetections() {
        return detections;
    }

    public void reset() {
        window.clear();
    }
}
