package no.ssb.dapla.pathfinder.model;

/**
 * What {@link Net#create(java.util.Collection, DuplicatePoints)} does with two nodes sharing an identifier.
 */
public enum DuplicatePoints {
    /**
     * Fail with an {@link IllegalArgumentException}.
     */
    REJECT,
    /**
     * Keep the first node and drop the others.
     */
    FIRST_WINS
}
