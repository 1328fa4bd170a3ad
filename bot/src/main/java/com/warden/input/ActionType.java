package com.warden.input;

/**
 * Kinds of input the action port understands.
 */
public enum ActionType {
    /** Left click at a screen position. */
    CLICK,
    /** Single key press. */
    KEY,
    /** The same key pressed several times. */
    KEY_SEQUENCE,
    /** Locate a template on screen and click it. */
    TEMPLATE_CLICK,
    /** Drink from a belt slot (key press with a potion label). */
    POTION
}
