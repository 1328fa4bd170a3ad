package com.warden.state;

/**
 * The closed set of states the bot can be in.
 * Exactly one is current at any instant; the process starts in {@link #IDLE}.
 */
public enum BotState {

    // Core
    IDLE,
    STARTING,
    STOPPING,

    // Menus and lobby
    MAIN_MENU,
    CHARACTER_SELECT,
    LOBBY,
    CREATING_GAME,
    JOINING_GAME,
    LOADING,

    // In game
    IN_TOWN,
    RUNNING,
    FIGHTING,
    LOOTING,
    RETURNING,

    // Town activities
    MANAGING_INVENTORY,
    STASHING,
    SHOPPING,
    HEALING,
    REPAIRING,
    LEVELING_UP,

    // Run-ending and error states
    STUCK,
    DEAD,
    CHICKENED,
    DISCONNECTED,
    ERROR;

    /**
     * Whether the character is inside a game session.
     *
     * @return true for town and run states
     */
    public boolean isInGame() {
        switch (this) {
            case IN_TOWN:
            case RUNNING:
            case FIGHTING:
            case LOOTING:
            case RETURNING:
            case MANAGING_INVENTORY:
            case STASHING:
            case SHOPPING:
            case HEALING:
            case REPAIRING:
            case LEVELING_UP:
            case STUCK:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether the bot is out in the world executing a run.
     * Domain handlers poll this to abort cooperatively after a preemption.
     *
     * @return true while a run is in progress
     */
    public boolean isRunPhase() {
        return this == RUNNING || this == FIGHTING || this == LOOTING
                || this == RETURNING || this == STUCK;
    }

    /**
     * Whether the bot is in town.
     *
     * @return true for IN_TOWN and town activities
     */
    public boolean isTownPhase() {
        return isInGame() && !isRunPhase();
    }

    /**
     * Whether this state ends the current run.
     *
     * @return true for DEAD, CHICKENED and DISCONNECTED
     */
    public boolean isRunTerminal() {
        return this == DEAD || this == CHICKENED || this == DISCONNECTED;
    }
}
