package io.github.yok.ciflink.codec;

import lombok.Getter;

/**
 * Raised when CIF text cannot be parsed.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class CifSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // 1-based line of the offending token
    private final int line;

    public CifSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }
}
