package no.ssb.dapla.pathfinder.model;

public class PathCannotBeBuiltException extends PathFinderException {

    public PathCannotBeBuiltException(Throwable cause) {
        super("Could not seed the search path", cause);
    }
}
