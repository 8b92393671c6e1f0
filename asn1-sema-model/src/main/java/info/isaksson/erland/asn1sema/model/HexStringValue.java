package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code '0FA3'H} */
public final class HexStringValue extends SemaNode {
    public final String value;

    public HexStringValue(String value) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.value = value;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.HEX_STRING_VALUE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "'" + value + "'H";
    }
}
