package no.ssb.dapla.pathfinder.model;

public class NoPathFoundException extends PathFinderException {

    private final Object fromId;
    private final Object toId;

    public NoPathFoundException(Object fromId, Object toId) {
        super(String.format("No path found between points \"%s\" and \"%s\"", fromId, toId));
        this.fromId = fromId;
        this.toId = toId;
    }

    public Object getFromId() {
        return fromId;
    }

    public Object getToId() {
        return toId;
    }
}
