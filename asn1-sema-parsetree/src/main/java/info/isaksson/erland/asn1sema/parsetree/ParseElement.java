package info.isaksson.erland.asn1sema.parsetree;

/**
 * One element of a parse node: a nested {@link ParseNode}, a raw {@link ParseToken},
 * or a nested {@link ParseSequence} of nodes.
 *
 * <p>The family is closed; the only subclasses are the three listed above.</p>
 */
public abstract class ParseElement {

    ParseElement() {}

    public boolean isNode() {
        return false;
    }

    public boolean isNode(ProductionKind kind) {
        return false;
    }

    public boolean isToken() {
        return false;
    }

    /** True for a token whose text equals {@code literal} exactly. */
    public boolean isToken(String literal) {
        return false;
    }

    public boolean isSequence() {
        return false;
    }

    public ParseNode asNode() {
        throw new MalformedParseTreeException("Expected a parse node but found " + describe());
    }

    public ParseToken asToken() {
        throw new MalformedParseTreeException("Expected a token but found " + describe());
    }

    public ParseSequence asSequence() {
        throw new MalformedParseTreeException("Expected a node sequence but found " + describe());
    }

    /** Short description used in error messages. */
    abstract String describe();
}
