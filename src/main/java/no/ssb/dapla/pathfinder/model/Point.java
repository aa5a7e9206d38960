package no.ssb.dapla.pathfinder.model;

import java.util.Objects;

/**
 * Anything that can be placed in a {@link Net}.
 * <p>
 * Points are compared by identifier only. The library never mutates a point, so implementations
 * should be small immutable values.
 *
 * @param <I> the identifier type, must implement equals and hashCode.
 */
public interface Point<I> {

    I getId();

    /**
     * Returns true if the other point has the same identifier.
     */
    default boolean isSame(Point<?> other) {
        return other != null && Objects.equals(getId(), other.getId());
    }
}
