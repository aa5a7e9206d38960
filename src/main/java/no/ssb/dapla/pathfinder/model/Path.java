package no.ssb.dapla.pathfinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered sequence of points, from a start point to an end point.
 * <p>
 * Paths handed out by the library are never modified afterwards. The search extends a path only on its own
 * {@link #copy()}, so sibling branches never share state.
 */
public class Path<T extends Point<?>> {

    public static final String DEFAULT_SEPARATOR = "-";

    private final List<T> points;

    Path(List<T> points) {
        this.points = new ArrayList<>(points);
    }

    public static <T extends Point<?>> PathBuilder<T> builder() {
        return new PathBuilder<>();
    }

    void push(T point) {
        points.add(Objects.requireNonNull(point));
    }

    public Path<T> copy() {
        return new Path<>(points);
    }

    public List<T> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public int size() {
        return points.size();
    }

    public T getStart() {
        return points.get(0);
    }

    public T getEnd() {
        return points.get(points.size() - 1);
    }

    public boolean contains(Point<?> point) {
        return points.stream().anyMatch(p -> p.isSame(point));
    }

    public boolean doesNotContain(Point<?> point) {
        return !contains(point);
    }

    public boolean endsWith(Point<?> point) {
        return !points.isEmpty() && getEnd().isSame(point);
    }

    public String render() {
        return render(DEFAULT_SEPARATOR);
    }

    public String render(String separator) {
        return points.stream()
                .map(point -> String.valueOf(point.getId()))
                .collect(Collectors.joining(separator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Path<?> path = (Path<?>) o;
        if (points.size() != path.points.size()) return false;
        for (int i = 0; i < points.size(); i++) {
            if (!points.get(i).isSame(path.points.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(points.stream().map(Point::getId).toArray());
    }

    @Override
    public String toString() {
        return render();
    }
}
