package no.ssb.dapla.pathfinder.model;

/**
 * Thrown when a search refers to a point that has no node in the net.
 */
public class PointNotFoundException extends PathFinderException {

    private final Object pointId;

    public PointNotFoundException(Object pointId) {
        super(String.format("The point with id \"%s\" could not be found", pointId));
        this.pointId = pointId;
    }

    public Object getPointId() {
        return pointId;
    }
}
