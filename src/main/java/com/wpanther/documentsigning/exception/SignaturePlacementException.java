package com.wpanther.documentsigning.exception;

/**
 * The visual stamp position could not be resolved: marker missing with no
 * default rectangle, marker ambiguous, or a required pre-placed field absent.
 */
public class SignaturePlacementException extends SigningException {

    public SignaturePlacementException(String message) {
        super(message);
    }
}
