package no.ssb.dapla.pathfinder.graph;

import no.ssb.dapla.pathfinder.model.Connection;
import no.ssb.dapla.pathfinder.model.Net;
import no.ssb.dapla.pathfinder.model.NetInconsistencyException;
import no.ssb.dapla.pathfinder.model.Node;
import no.ssb.dapla.pathfinder.model.Point;
import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A jgrapht view of a {@link Net}. Vertices are the points of the nodes and every connection is a directed edge.
 */
public class NetGraph<T extends Point<?>> {

    private final Net<T> net;
    private final Graph<T, DefaultEdge> graph;

    public NetGraph(Net<T> net) {
        this.net = Objects.requireNonNull(net);
        DefaultDirectedGraph<T, DefaultEdge> directed = new DefaultDirectedGraph<>(DefaultEdge.class);
        net.getNodes().forEach(node -> directed.addVertex(node.getPoint()));
        for (Node<T> node : net.getNodes()) {
            for (Connection<T> connection : node.getConnections()) {
                directed.addEdge(node.getPoint(), vertexOf(node, connection.getTarget()));
            }
        }
        this.graph = new AsUnmodifiableGraph<>(directed);
    }

    public Graph<T, DefaultEdge> getGraph() {
        return graph;
    }

    public int getOutDegreeOf(T point) {
        return graph.outDegreeOf(vertexOf(point));
    }

    public int getInDegreeOf(T point) {
        return graph.inDegreeOf(vertexOf(point));
    }

    /**
     * Returns true if every connection has a connection back.
     */
    public boolean isUndirected() {
        return getOneWayConnections().isEmpty();
    }

    /**
     * The edges that have no edge in the opposite direction.
     */
    public List<DefaultEdge> getOneWayConnections() {
        return graph.edgeSet().stream()
                .filter(edge -> !graph.containsEdge(graph.getEdgeTarget(edge), graph.getEdgeSource(edge)))
                .collect(Collectors.toList());
    }

    private T vertexOf(T point) {
        return net.findNode(point)
                .map(Node::getPoint)
                .orElseThrow(() -> new IllegalArgumentException("No node for point " + point.getId()));
    }

    // Targets are resolved to the subject point of their node so each point is a single vertex.
    private T vertexOf(Node<T> source, T target) {
        return net.findNode(target)
                .map(Node::getPoint)
                .orElseThrow(() -> new NetInconsistencyException(source.getPoint().getId(), target.getId()));
    }
}
