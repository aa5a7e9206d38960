package no.ssb.dapla.pathfinder.model;

/**
 * Base class of the recoverable errors raised when building nodes, paths and nets or when searching them.
 */
public abstract class PathFinderException extends Exception {

    protected PathFinderException(String message) {
        super(message);
    }

    protected PathFinderException(String message, Throwable cause) {
        super(message, cause);
    }
}
