package com.purchasingpower.crewflow.transition;

public enum TransferPhase {
    /** Before the reply: the draft is discarded and the new crew answers the same message. */
    PRE,
    /** After the reply: the new crew answers the next message. */
    POST
}
