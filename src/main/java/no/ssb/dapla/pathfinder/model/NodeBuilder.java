package no.ssb.dapla.pathfinder.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

public class NodeBuilder<T extends Point<?>> {

    private T point;
    private final List<Connection<T>> connections = new ArrayList<>();

    NodeBuilder() {
    }

    public NodeBuilder<T> setPoint(T point) {
        this.point = Objects.requireNonNull(point);
        return this;
    }

    /**
     * Connects to the point unless a connection to the same point already exists.
     */
    public NodeBuilder<T> addConnection(T target) {
        Connection<T> connection = new Connection<>(target);
        if (!connections.contains(connection)) {
            connections.add(connection);
        }
        return this;
    }

    public NodeBuilder<T> addConnections(Collection<? extends T> targets) {
        Objects.requireNonNull(targets).forEach(this::addConnection);
        return this;
    }

    public Node<T> build() throws MissingPointException, SelfConnectionException {
        if (point == null) {
            throw new MissingPointException();
        }
        for (Connection<T> connection : connections) {
            if (connection.targets(point)) {
                throw new SelfConnectionException(point.getId());
            }
        }
        return new Node<>(point, connections);
    }
}
