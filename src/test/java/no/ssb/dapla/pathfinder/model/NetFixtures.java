package no.ssb.dapla.pathfinder.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static no.ssb.dapla.pathfinder.model.SimplePoint.point;

/**
 * Builds nets of {@link SimplePoint}s from adjacency strings such as {@code "A:BD"}.
 */
final class NetFixtures {

    private NetFixtures() {
    }

    static Net<SimplePoint> net(String... adjacencies) {
        return Net.create(nodes(adjacencies));
    }

    static List<Node<SimplePoint>> nodes(String... adjacencies) {
        Map<Character, SimplePoint> points = new LinkedHashMap<>();
        List<Node<SimplePoint>> nodes = new ArrayList<>();
        for (String adjacency : adjacencies) {
            String[] parts = adjacency.split(":", -1);
            NodeBuilder<SimplePoint> builder = Node.<SimplePoint>builder()
                    .setPoint(points.computeIfAbsent(parts[0].charAt(0), SimplePoint::new));
            for (char target : parts[1].toCharArray()) {
                builder.addConnection(points.computeIfAbsent(target, SimplePoint::new));
            }
            try {
                nodes.add(builder.build());
            } catch (PathFinderException e) {
                throw new IllegalArgumentException(adjacency, e);
            }
        }
        return nodes;
    }

    static List<String> render(List<Path<SimplePoint>> paths) {
        List<String> rendered = new ArrayList<>();
        paths.forEach(path -> rendered.add(path.render()));
        return rendered;
    }

    static SimplePoint p(char name) {
        return point(name);
    }
}
