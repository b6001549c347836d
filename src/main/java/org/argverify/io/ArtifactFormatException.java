package org.argverify.io;

/**
 * A submitted artifact does not have the expected structure.
 */
public class ArtifactFormatException extends IllegalArgumentException {

    public ArtifactFormatException(String message) {
        super(message);
    }

    public ArtifactFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
