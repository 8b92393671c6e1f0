package info.isaksson.erland.asn1sema.parsetree;

/**
 * A parse node carries a tag outside the recognized vocabulary, or a structural tag was handed
 * to node dispatch where only node-producing productions are valid.
 */
public class UnknownNodeKindException extends IllegalArgumentException {

    private final String tag;

    public UnknownNodeKindException(String tag) {
        super("Unknown parse node kind: " + tag);
        this.tag = tag;
    }

    public UnknownNodeKindException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
