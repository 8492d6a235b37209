package com.hashkit.codec;

/**
 * Thrown when an encoded string does not follow the length-prefixed format.
 */
public class MalformedEncodingException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int offset;

    public MalformedEncodingException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    /**
     * Position in the encoded string where parsing failed.
     */
    public int getOffset() {
        return offset;
    }
}
