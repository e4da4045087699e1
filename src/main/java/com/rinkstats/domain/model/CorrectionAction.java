package com.rinkstats.domain.model;

public enum CorrectionAction {
    /** Overwrite the field with the rule value; an empty value clears it. */
    SET,
    /** Replace the rule's find text inside the field with the rule value. */
    REPLACE,
    /** Exchange the player in the rule's field with the player slot named by the value. */
    SWAP_PLAYERS,
    /** Remove the event from its source stream. */
    DROP
}
