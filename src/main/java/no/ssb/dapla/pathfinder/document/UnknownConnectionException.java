package no.ssb.dapla.pathfinder.document;

import no.ssb.dapla.pathfinder.model.PathFinderException;

public class UnknownConnectionException extends PathFinderException {

    public UnknownConnectionException(String nodeId, String connectionId) {
        super(String.format("The node \"%s\" is connected to \"%s\" which is not declared", nodeId, connectionId));
    }
}
