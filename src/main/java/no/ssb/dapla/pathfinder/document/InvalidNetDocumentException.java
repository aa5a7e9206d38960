package no.ssb.dapla.pathfinder.document;

import no.ssb.dapla.pathfinder.model.PathFinderException;

public class InvalidNetDocumentException extends PathFinderException {

    public InvalidNetDocumentException(String message) {
        super(message);
    }

    public InvalidNetDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
