package no.ssb.dapla.pathfinder.model;

public class MissingPointException extends PathFinderException {

    public MissingPointException() {
        super("A node must have a point");
    }
}
