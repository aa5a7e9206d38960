package no.ssb.dapla.pathfinder.model;

public class EmptyPathException extends PathFinderException {

    public EmptyPathException() {
        super("Should set at least one point for the path");
    }
}
