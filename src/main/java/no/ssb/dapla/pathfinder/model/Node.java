package no.ssb.dapla.pathfinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A point and its outbound connections, in insertion order.
 * <p>
 * Connections are one-way: for an edge to be traversable both ways, both nodes must list each other.
 * Instances are immutable and are created with {@link #builder()}.
 */
public class Node<T extends Point<?>> {

    private final T point;
    private final List<Connection<T>> connections;

    Node(T point, List<Connection<T>> connections) {
        this.point = Objects.requireNonNull(point);
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
    }

    public static <T extends Point<?>> NodeBuilder<T> builder() {
        return new NodeBuilder<>();
    }

    public T getPoint() {
        return point;
    }

    public List<Connection<T>> getConnections() {
        return connections;
    }

    public boolean pointIs(Point<?> other) {
        return point.isSame(other);
    }

    public boolean isConnectedTo(Point<?> other) {
        return connections.stream().anyMatch(connection -> connection.targets(other));
    }

    /**
     * The connected points that are not part of the given path, in connection order.
     *
     * @return the points, or empty if every connected point is already in the path.
     */
    public Optional<List<T>> connectedPointsNotIn(Path<T> path) {
        List<T> candidates = connections.stream()
                .map(Connection::getTarget)
                .filter(path::doesNotContain)
                .collect(Collectors.toList());
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node<?> node = (Node<?>) o;
        return point.isSame(node.point) && connections.equals(node.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(point.getId(), connections);
    }

    @Override
    public String toString() {
        return "Node{point=" + point.getId() + ", connections=" + connections.stream()
                .map(connection -> String.valueOf(connection.getTarget().getId()))
                .collect(Collectors.joining(",", "[", "]")) + '}';
    }
}
