package no.ssb.dapla.pathfinder.model;

import java.util.Objects;

/**
 * A directed edge to a target point. Two connections are equal when they target the same point.
 */
public class Connection<T extends Point<?>> {

    private final T target;

    public Connection(T target) {
        this.target = Objects.requireNonNull(target);
    }

    public T getTarget() {
        return target;
    }

    public boolean targets(Point<?> point) {
        return target.isSame(point);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection<?> that = (Connection<?>) o;
        return target.isSame(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(target.getId());
    }

    @Override
    public String toString() {
        return "Connection{to=" + target.getId() + '}';
    }
}
