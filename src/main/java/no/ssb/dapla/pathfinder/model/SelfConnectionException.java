package no.ssb.dapla.pathfinder.model;

public class SelfConnectionException extends PathFinderException {

    private final Object pointId;

    public SelfConnectionException(Object pointId) {
        super(String.format("The point with id \"%s\" cannot be connected to itself", pointId));
        this.pointId = pointId;
    }

    public Object getPointId() {
        return pointId;
    }
}
