package io.github.yok.ciflink.metadata;

/**
 * Raised when a dictionary or schema source cannot be read or parsed.
 *
 * @author Yasuharu.Okawauchi
 */
public class MetadataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
