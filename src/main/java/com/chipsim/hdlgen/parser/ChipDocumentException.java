package com.chipsim.hdlgen.parser;

/**
 * A chip document that is valid JSON but cannot describe a chip graph.
 */
public class ChipDocumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ChipDocumentException(String message) {
        super(message);
    }

    public ChipDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
