package no.ssb.dapla.pathfinder.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of a net of {@link NamedPoint}s. Connections refer to other nodes by id.
 */
public class NetDocument {

    public List<NodeEntry> nodes = new ArrayList<>();

    public static class NodeEntry {
        public String id;
        public String name;
        public List<String> connections = new ArrayList<>();
    }
}
