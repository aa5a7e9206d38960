package no.ssb.dapla.pathfinder.model;

/**
 * A connection targets a point that has no node in the net. This is a broken net, not a bad query,
 * and is never recovered from.
 */
public class NetInconsistencyException extends IllegalStateException {

    private final Object pointId;

    public NetInconsistencyException(Object sourceId, Object pointId) {
        super(String.format("The point \"%s\" is connected to \"%s\" which has no node in the net",
                sourceId, pointId));
        this.pointId = pointId;
    }

    public Object getPointId() {
        return pointId;
    }
}
