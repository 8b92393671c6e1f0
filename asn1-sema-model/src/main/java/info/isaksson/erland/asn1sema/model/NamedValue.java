package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code identifier(value)} inside an enumeration, INTEGER named number list or BIT STRING. */
public final class NamedValue extends SemaNode {
    public final String identifier;
    /** String form of the value; null until numbered when the source omits it. */
    public final String value;

    public NamedValue(String identifier, String value) {
        if (identifier == null) throw new IllegalArgumentException("identifier must not be null");
        this.identifier = identifier;
        this.value = value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public NamedValue withValue(String newValue) {
        return new NamedValue(identifier, newValue);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.NAMED_VALUE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return identifier + " (" + value + ")";
    }
}
