package nl.bytesoflife.deltacad.codec;

/**
 * Raised when a record cannot be turned into a primitive: unknown type tag, missing or malformed
 * required field, or malformed JSON text. No partially built primitive escapes.
 */
public class DecodeException extends RuntimeException {

    private final String recordType;
    private final String field;

    public DecodeException(String message) {
        this(message, null, null);
    }

    public DecodeException(String message, String recordType, String field) {
        super(message);
        this.recordType = recordType;
        this.field = field;
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
        this.recordType = null;
        this.field = null;
    }

    /**
     * The record's {@code type} tag, or null when unknown at the time of failure.
     */
    public String getRecordType() {
        return recordType;
    }

    public String getField() {
        return field;
    }
}
