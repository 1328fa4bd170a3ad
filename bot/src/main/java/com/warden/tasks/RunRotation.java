package com.warden.tasks;

import com.warden.config.BotConfig;
import com.warden.state.BotState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handler for {@link BotState#RUNNING}: executes the enabled runs in turn.
 *
 * <p>When {@code enabledRuns} is configured only those runs take part, in the order
 * given. When {@code runCount} is positive the rotation asks to stop after that many
 * runs.
 */
@Slf4j
public class RunRotation implements StateHandler {

    private final List<Run> runs;
    private final int runCount;

    private int next;
    private int completed;

    public RunRotation(List<Run> available, BotConfig config) {
        this.runs = select(available, config.getEnabledRuns());
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("No runs enabled out of " + names(available));
        }
        this.runCount = config.getRunCount();
        log.info("Run rotation: {} ({})", names(runs), runCount > 0 ? runCount + " runs" : "unlimited");
    }

    private static List<Run> select(List<Run> available, List<String> enabled) {
        if (enabled.isEmpty()) {
            return List.copyOf(available);
        }
        List<Run> selected = new ArrayList<>();
        for (String name : enabled) {
            String wanted = name.toLowerCase(Locale.ROOT);
            available.stream()
                    .filter(run -> run.getName().toLowerCase(Locale.ROOT).equals(wanted))
                    .findFirst()
                    .ifPresentOrElse(selected::add, () -> log.warn("Enabled run '{}' is not available", name));
        }
        return List.copyOf(selected);
    }

    private static Set<String> names(List<Run> runs) {
        return runs.stream().map(Run::getName).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public RunResult handle(HandlerContext ctx) {
        if (isFinished()) {
            log.info("Completed {} runs, stopping", completed);
            return RunResult.next(BotState.STOPPING);
        }
        Run run = runs.get(next);
        next = (next + 1) % runs.size();
        RunResult result = run.execute(ctx);
        completed++;
        return result;
    }

    public boolean isFinished() {
        return runCount > 0 && completed >= runCount;
    }

    public int getCompleted() {
        return completed;
    }

    public List<Run> getRuns() {
        return runs;
    }
}
