package no.ssb.dapla.pathfinder.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.helidon.config.Config;
import no.ssb.dapla.pathfinder.model.DuplicatePoints;
import no.ssb.dapla.pathfinder.model.Net;
import no.ssb.dapla.pathfinder.model.Node;
import no.ssb.dapla.pathfinder.model.NodeBuilder;
import no.ssb.dapla.pathfinder.model.PathFinderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a {@link Net} of {@link NamedPoint}s from a JSON or YAML {@link NetDocument}.
 */
public class NetReader {

    private static final Logger log = LoggerFactory.getLogger(NetReader.class);

    static final String FORMAT = "net.format";
    static final String DUPLICATE_POINTS = "net.duplicate-points";

    private final ObjectMapper mapper;
    private final DuplicatePoints duplicatePoints;

    public NetReader(ObjectMapper mapper, DuplicatePoints duplicatePoints) {
        this.mapper = Objects.requireNonNull(mapper);
        this.duplicatePoints = Objects.requireNonNull(duplicatePoints);
    }

    public static NetReader json() {
        return new NetReader(new ObjectMapper(), DuplicatePoints.REJECT);
    }

    public static NetReader yaml() {
        return new NetReader(new ObjectMapper(new YAMLFactory()), DuplicatePoints.REJECT);
    }

    public static NetReader create(Config config) {
        Objects.requireNonNull(config);
        String format = config.get(FORMAT).asString().orElse("json");
        DuplicatePoints duplicatePoints = config.get(DUPLICATE_POINTS).asString()
                .map(NetReader::duplicatePoints)
                .orElse(DuplicatePoints.REJECT);
        switch (format.toLowerCase(Locale.ROOT)) {
            case "json":
                return new NetReader(new ObjectMapper(), duplicatePoints);
            case "yaml":
                return new NetReader(new ObjectMapper(new YAMLFactory()), duplicatePoints);
            default:
                throw new IllegalArgumentException("Unsupported net format: " + format);
        }
    }

    private static DuplicatePoints duplicatePoints(String value) {
        String name = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DuplicatePoints candidate : DuplicatePoints.values()) {
            if (candidate.name().equals(name)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException(String.format("Unsupported %s: %s, expected one of %s",
                DUPLICATE_POINTS, value, Arrays.toString(DuplicatePoints.values())));
    }

    public DuplicatePoints getDuplicatePoints() {
        return duplicatePoints;
    }

    public Net<NamedPoint> read(InputStream input) throws IOException, PathFinderException {
        Objects.requireNonNull(input);
        NetDocument document = mapper.readValue(input, NetDocument.class);
        return toNet(document);
    }

    public Net<NamedPoint> read(String content) throws IOException, PathFinderException {
        Objects.requireNonNull(content);
        return toNet(mapper.readValue(content, NetDocument.class));
    }

    Net<NamedPoint> toNet(NetDocument document) throws PathFinderException {
        if (document.nodes == null) {
            throw new InvalidNetDocumentException("A net document must have a list of nodes");
        }

        // The first declaration of an id names the point.
        Map<String, NamedPoint> pointById = new LinkedHashMap<>();
        for (NetDocument.NodeEntry entry : document.nodes) {
            if (entry.id == null) {
                throw new InvalidNetDocumentException("Every node must have an id");
            }
            pointById.putIfAbsent(entry.id, new NamedPoint(entry.id, entry.name));
        }

        // Entries dropped by FIRST_WINS are not validated.
        Set<String> emitted = new HashSet<>();
        List<Node<NamedPoint>> nodes = new ArrayList<>();
        for (NetDocument.NodeEntry entry : document.nodes) {
            if (!emitted.add(entry.id) && duplicatePoints == DuplicatePoints.FIRST_WINS) {
                log.warn("Ignoring duplicate node for point {}", entry.id);
                continue;
            }
            NodeBuilder<NamedPoint> builder = Node.<NamedPoint>builder().setPoint(pointById.get(entry.id));
            List<String> connections = entry.connections == null ? List.of() : entry.connections;
            for (String connectionId : connections) {
                NamedPoint target = pointById.get(connectionId);
                if (target == null) {
                    throw new UnknownConnectionException(entry.id, connectionId);
                }
                builder.addConnection(target);
            }
            nodes.add(builder.build());
        }

        log.debug("Read net with {} node(s)", nodes.size());
        try {
            return Net.create(nodes, duplicatePoints);
        } catch (IllegalArgumentException e) {
            throw new InvalidNetDocumentException(e.getMessage(), e);
        }
    }
}
