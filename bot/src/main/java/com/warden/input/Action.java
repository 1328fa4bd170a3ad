package com.warden.input;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * One request to the action port. Immutable; build with the static factories.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Action {

    ActionType type;

    int x;
    int y;

    @Nullable
    String key;

    int repeats;

    /** Template name for {@link ActionType#TEMPLATE_CLICK}. */
    @Nullable
    String template;

    /** Human-readable purpose, for logs. */
    String label;

    public static Action click(int x, int y, String label) {
        return new Action(ActionType.CLICK, x, y, null, 1, null, label);
    }

    public static Action key(String key, String label) {
        return new Action(ActionType.KEY, 0, 0, key, 1, null, label);
    }

    public static Action keySequence(String key, int repeats, String label) {
        if (repeats < 1) {
            throw new IllegalArgumentException("repeats must be at least 1, was " + repeats);
        }
        return new Action(ActionType.KEY_SEQUENCE, 0, 0, key, repeats, null, label);
    }

    public static Action templateClick(String template, String label) {
        return new Action(ActionType.TEMPLATE_CLICK, 0, 0, null, 1, template, label);
    }

    public static Action potion(String beltKey, String label) {
        return new Action(ActionType.POTION, 0, 0, beltKey, 1, null, label);
    }

    @Override
    public String toString() {
        switch (type) {
            case CLICK:
                return String.format("click(%d, %d) [%s]", x, y, label);
            case KEY:
            case POTION:
                return String.format("%s(%s) [%s]", type.name().toLowerCase(), key, label);
            case KEY_SEQUENCE:
                return String.format("keys(%s x%d) [%s]", key, repeats, label);
            case TEMPLATE_CLICK:
                return String.format("template(%s) [%s]", template, label);
            default:
                return label;
        }
    }
}
