package com.kekopoly.server.hub;

/** What happened to a frame handed to a {@link PriorityOutbox}. */
public enum DeliveryOutcome {
    ENQUEUED,
    /** Target tier was full; the frame went into a higher one. */
    ESCALATED,
    /** High tier was full; its oldest frame was discarded to make room. */
    EVICTED_OLDEST,
    DROPPED,
    CLOSED;

    public boolean delivered() {
        return this == ENQUEUED || this == ESCALATED || this == EVICTED_OLDEST;
    }
}
