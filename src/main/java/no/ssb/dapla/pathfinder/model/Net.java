package no.ssb.dapla.pathfinder.model;

import io.helidon.common.reactive.Single;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * A set of nodes, at most one per point identifier, that can be searched for every simple path between two
 * of its points.
 * <p>
 * A net never changes once created, so any number of searches can run on it at the same time.
 */
public class Net<T extends Point<?>> {

    private static final Logger log = LoggerFactory.getLogger(Net.class);

    private final Map<Object, Node<T>> nodeById;

    private Net(Map<Object, Node<T>> nodeById) {
        this.nodeById = nodeById;
    }

    public static <T extends Point<?>> Net<T> create(Collection<Node<T>> nodes) {
        return create(nodes, DuplicatePoints.REJECT);
    }

    public static <T extends Point<?>> Net<T> create(Collection<Node<T>> nodes, DuplicatePoints duplicatePoints) {
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(duplicatePoints);
        Map<Object, Node<T>> nodeById = new LinkedHashMap<>();
        for (Node<T> node : nodes) {
            Object id = node.getPoint().getId();
            if (nodeById.containsKey(id)) {
                if (duplicatePoints == DuplicatePoints.REJECT) {
                    throw new IllegalArgumentException(
                            String.format("The net already contains a node for point \"%s\"", id));
                }
                log.warn("Ignoring duplicate node for point {}", id);
                continue;
            }
            nodeById.put(id, node);
        }
        return new Net<>(nodeById);
    }

    public Collection<Node<T>> getNodes() {
        return Collections.unmodifiableCollection(nodeById.values());
    }

    public Optional<Node<T>> findNode(Point<?> point) {
        return Optional.ofNullable(nodeById.get(point.getId()));
    }

    public boolean contains(Point<?> point) {
        return nodeById.containsKey(point.getId());
    }

    /**
     * Finds every simple path from one point to another.
     * <p>
     * Paths are returned in the order the connections were added to the nodes. They are not sorted.
     *
     * @throws PointNotFoundException if either point has no node, the from point is checked first.
     * @throws NoPathFoundException   if the points are not connected.
     * @throws NetInconsistencyException if a connection leads to a point without a node.
     */
    public List<Path<T>> findPaths(T from, T to) throws PathFinderException {
        Node<T> start = findNodeOrThrow(from);
        findNodeOrThrow(to);

        log.debug("Searching paths from {} to {}", from.getId(), to.getId());
        List<Path<T>> paths = search(start, to, seed(from));
        if (paths.isEmpty()) {
            throw new NoPathFoundException(from.getId(), to.getId());
        }
        log.debug("Found {} path(s) from {} to {}", paths.size(), from.getId(), to.getId());
        return paths;
    }

    /**
     * Same as {@link #findPaths(Point, Point)} but explores each connection of the start point on the executor.
     * The paths come out in the same order as with {@link #findPaths(Point, Point)}.
     */
    public Single<List<Path<T>>> findPathsAsync(T from, T to, Executor executor) {
        Objects.requireNonNull(executor);
        Node<T> start;
        Path<T> seed;
        try {
            start = findNodeOrThrow(from);
            findNodeOrThrow(to);
            seed = seed(from);
        } catch (PathFinderException e) {
            return Single.error(e);
        }
        if (seed.endsWith(to)) {
            return Single.just(List.of(seed));
        }

        List<CompletableFuture<List<Path<T>>>> branches;
        try {
            branches = start.connectedPointsNotIn(seed)
                    .orElse(List.of())
                    .stream()
                    .map(candidate -> CompletableFuture.supplyAsync(() -> branch(start, candidate, to, seed), executor))
                    .collect(Collectors.toList());
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected search from {} to {}", from.getId(), to.getId());
            return Single.error(e);
        }

        CompletableFuture<List<Path<T>>> result = new CompletableFuture<>();
        CompletableFuture.allOf(branches.toArray(new CompletableFuture[0])).whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(unwrap(throwable));
                return;
            }
            List<Path<T>> paths = branches.stream()
                    .flatMap(branch -> branch.join().stream())
                    .collect(Collectors.toList());
            if (paths.isEmpty()) {
                result.completeExceptionally(new NoPathFoundException(from.getId(), to.getId()));
            } else {
                log.debug("Found {} path(s) from {} to {}", paths.size(), from.getId(), to.getId());
                result.complete(paths);
            }
        });
        return Single.create(result);
    }

    private List<Path<T>> search(Node<T> current, T destination, Path<T> pathSoFar) {
        if (pathSoFar.endsWith(destination)) {
            return List.of(pathSoFar);
        }
        Optional<List<T>> candidates = current.connectedPointsNotIn(pathSoFar);
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Path<T>> found = new ArrayList<>();
        for (T candidate : candidates.get()) {
            found.addAll(branch(current, candidate, destination, pathSoFar));
        }
        return found;
    }

    private List<Path<T>> branch(Node<T> current, T candidate, T destination, Path<T> pathSoFar) {
        Node<T> next = nodeById.get(candidate.getId());
        if (next == null) {
            NetInconsistencyException e = new NetInconsistencyException(current.getPoint().getId(), candidate.getId());
            log.error("Broken net", e);
            throw e;
        }
        Path<T> extended = pathSoFar.copy();
        extended.push(candidate);
        return search(next, destination, extended);
    }

    private Node<T> findNodeOrThrow(T point) throws PointNotFoundException {
        Objects.requireNonNull(point);
        return findNode(point).orElseThrow(() -> new PointNotFoundException(point.getId()));
    }

    private Path<T> seed(T from) throws PathCannotBeBuiltException {
        try {
            return Path.<T>builder().addPoint(from).build();
        } catch (EmptyPathException e) {
            throw new PathCannotBeBuiltException(e);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

    @Override
    public String toString() {
        return "Net{nodes=" + nodeById.values() + '}';
    }
}
