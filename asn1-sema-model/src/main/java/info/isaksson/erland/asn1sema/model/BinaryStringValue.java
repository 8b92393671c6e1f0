package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code '0101'B} */
public final class BinaryStringValue extends SemaNode {
    public final String value;

    public BinaryStringValue(String value) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.value = value;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.BINARY_STRING_VALUE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "'" + value + "'B";
    }
}
