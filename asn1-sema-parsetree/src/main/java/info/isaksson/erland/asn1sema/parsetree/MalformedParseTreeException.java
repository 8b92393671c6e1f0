package info.isaksson.erland.asn1sema.parsetree;

/**
 * A parse node does not have the shape its production guarantees (element count, nested tags,
 * token vs node). This indicates a mismatch between the upstream grammar and the model builder
 * and is never recovered from locally.
 */
public class MalformedParseTreeException extends IllegalArgumentException {

    public MalformedParseTreeException(String message) {
        super(message);
    }

    public MalformedParseTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
