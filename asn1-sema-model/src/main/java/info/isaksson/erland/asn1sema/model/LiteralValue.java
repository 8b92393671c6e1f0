package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * Raw literal taken verbatim from the parse tree: numbers, {@code MIN}/{@code MAX}, booleans,
 * quoted strings and similar scalars that have no dedicated node.
 */
public final class LiteralValue extends SemaNode {
    public final String text;

    public LiteralValue(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        this.text = text;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.LITERAL_VALUE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return text;
    }
}
