package no.ssb.dapla.pathfinder.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public class PathBuilder<T extends Point<?>> {

    private final List<T> points = new ArrayList<>();

    PathBuilder() {
    }

    public PathBuilder<T> addPoint(T point) {
        points.add(Objects.requireNonNull(point));
        return this;
    }

    public PathBuilder<T> addPoints(Collection<? extends T> points) {
        Objects.requireNonNull(points).forEach(this::addPoint);
        return this;
    }

    public Path<T> build() throws EmptyPathException {
        if (points.isEmpty()) {
            throw new EmptyPathException();
        }
        return new Path<>(points);
    }
}
