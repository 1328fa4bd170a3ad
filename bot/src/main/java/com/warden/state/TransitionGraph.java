package com.warden.state;

import com.warden.config.BotConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed directed graph of allowed state transitions, with optional guards per edge.
 *
 * <p>The graph is built once and never mutated, so reads need no locking.
 * Any (from, to) pair absent from the graph is rejected by the state machine.
 */
public final class TransitionGraph {

    private final Map<BotState, Set<BotState>> edges;
    private final Map<Edge, TransitionGuard> guards;

    private TransitionGraph(Map<BotState, Set<BotState>> edges, Map<Edge, TransitionGuard> guards) {
        this.edges = edges;
        this.guards = guards;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether (from, to) is an edge.
     *
     * @param from source state
     * @param to   target state
     * @return true if the edge exists
     */
    public boolean contains(BotState from, BotState to) {
        Set<BotState> targets = edges.get(from);
        return targets != null && targets.contains(to);
    }

    /**
     * Guard attached to an edge.
     *
     * @param from source state
     * @param to   target state
     * @return the guard, {@link TransitionGuard#ALWAYS} if none
     */
    public TransitionGuard guardFor(BotState from, BotState to) {
        return guards.getOrDefault(new Edge(from, to), TransitionGuard.ALWAYS);
    }

    public boolean hasGuard(BotState from, BotState to) {
        return guards.containsKey(new Edge(from, to));
    }

    /**
     * States reachable in one step from the given state.
     *
     * @param from source state
     * @return unmodifiable target set
     */
    public Set<BotState> targetsFrom(BotState from) {
        return edges.getOrDefault(from, Collections.emptySet());
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * The standard bot graph. The only configured guard is the health requirement
     * for leaving town on a run; an unknown health reading does not block it.
     *
     * @param config source of guard thresholds
     * @return immutable graph
     */
    public static TransitionGraph standard(BotConfig config) {
        int minHealth = config.getMinHealthToStartRun();

        return builder()
                .allow(BotState.IDLE, BotState.STARTING, BotState.STOPPING)
                .allow(BotState.STARTING, BotState.MAIN_MENU, BotState.CHARACTER_SELECT,
                        BotState.IN_TOWN, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.MAIN_MENU, BotState.CHARACTER_SELECT, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.CHARACTER_SELECT, BotState.LOBBY, BotState.CREATING_GAME,
                        BotState.MAIN_MENU, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.LOBBY, BotState.CREATING_GAME, BotState.JOINING_GAME,
                        BotState.CHARACTER_SELECT, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.CREATING_GAME, BotState.LOADING, BotState.LOBBY, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.JOINING_GAME, BotState.LOADING, BotState.LOBBY, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.LOADING, BotState.IN_TOWN, BotState.MAIN_MENU, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.IN_TOWN, BotState.RUNNING, BotState.MANAGING_INVENTORY, BotState.STASHING,
                        BotState.SHOPPING, BotState.HEALING, BotState.REPAIRING, BotState.LEVELING_UP,
                        BotState.LOADING, BotState.MAIN_MENU, BotState.DISCONNECTED, BotState.ERROR,
                        BotState.STOPPING)
                .allow(BotState.RUNNING, BotState.FIGHTING, BotState.LOOTING, BotState.RETURNING,
                        BotState.IN_TOWN, BotState.DEAD, BotState.CHICKENED, BotState.STUCK,
                        BotState.DISCONNECTED, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.FIGHTING, BotState.RUNNING, BotState.LOOTING, BotState.DEAD,
                        BotState.CHICKENED, BotState.STUCK, BotState.DISCONNECTED, BotState.ERROR,
                        BotState.STOPPING)
                .allow(BotState.LOOTING, BotState.RUNNING, BotState.FIGHTING, BotState.RETURNING,
                        BotState.DEAD, BotState.CHICKENED, BotState.DISCONNECTED, BotState.ERROR,
                        BotState.STOPPING)
                .allow(BotState.RETURNING, BotState.IN_TOWN, BotState.LOADING, BotState.MANAGING_INVENTORY,
                        BotState.DEAD, BotState.CHICKENED, BotState.DISCONNECTED, BotState.ERROR,
                        BotState.STOPPING)
                .allow(BotState.MANAGING_INVENTORY, BotState.IN_TOWN, BotState.STASHING, BotState.SHOPPING,
                        BotState.ERROR, BotState.STOPPING)
                .allow(BotState.STASHING, BotState.IN_TOWN, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.SHOPPING, BotState.IN_TOWN, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.HEALING, BotState.IN_TOWN, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.REPAIRING, BotState.IN_TOWN, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.LEVELING_UP, BotState.IN_TOWN, BotState.RUNNING, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.DEAD, BotState.IN_TOWN, BotState.MAIN_MENU, BotState.ERROR, BotState.STOPPING)
                .allow(BotState.CHICKENED, BotState.MAIN_MENU, BotState.CHARACTER_SELECT, BotState.IN_TOWN,
                        BotState.ERROR, BotState.STOPPING)
                .allow(BotState.STUCK, BotState.RUNNING, BotState.IN_TOWN, BotState.CHICKENED,
                        BotState.ERROR, BotState.STOPPING)
                .allow(BotState.ERROR, BotState.IDLE, BotState.MAIN_MENU, BotState.STOPPING)
                .allow(BotState.DISCONNECTED, BotState.MAIN_MENU, BotState.STARTING, BotState.ERROR,
                        BotState.STOPPING)
                .allow(BotState.STOPPING, BotState.IDLE)
                .guard(BotState.IN_TOWN, BotState.RUNNING, latest -> {
                    var health = latest.getHealthPercent();
                    return health.isEmpty() || health.getAsDouble() >= minHealth;
                })
                .build();
    }

    @Override
    public String toString() {
        return String.format("TransitionGraph[states=%d, edges=%d, guards=%d]",
                edges.size(), edgeCount(), guards.size());
    }

    private record Edge(BotState from, BotState to) {
    }

    /**
     * Accumulates edges and guards; {@link #build()} freezes them.
     */
    public static final class Builder {

        private final Map<BotState, Set<BotState>> edges = new EnumMap<>(BotState.class);
        private final Map<Edge, TransitionGuard> guards = new HashMap<>();

        private Builder() {
        }

        public Builder allow(BotState from, BotState... targets) {
            Set<BotState> set = edges.computeIfAbsent(from, k -> EnumSet.noneOf(BotState.class));
            Collections.addAll(set, targets);
            return this;
        }

        /**
         * Attach a guard to an existing edge.
         *
         * @throws IllegalStateException if the edge was not allowed first
         */
        public Builder guard(BotState from, BotState to, TransitionGuard guard) {
            Set<BotState> targets = edges.get(from);
            if (targets == null || !targets.contains(to)) {
                throw new IllegalStateException("Cannot guard missing edge " + from + " -> " + to);
            }
            guards.put(new Edge(from, to), guard);
            return this;
        }

        public TransitionGraph build() {
            Map<BotState, Set<BotState>> frozen = new EnumMap<>(BotState.class);
            edges.forEach((from, targets) ->
                    frozen.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
            return new TransitionGraph(Collections.unmodifiableMap(frozen), Map.copyOf(guards));
        }
    }
}
