package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code BIT STRING}, optionally with named bit positions. */
public final class BitStringType extends TypeDeclaration {
    public final String typeName;
    public final List<SemaNode> namedBits;

    public BitStringType(String typeName, List<? extends SemaNode> namedBits) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        this.typeName = typeName;
        this.namedBits = namedBits == null ? List.of() : List.copyOf(namedBits);
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.BIT_STRING_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return namedBits;
    }

    @Override
    public String toString() {
        if (namedBits.isEmpty()) return typeName;
        return typeName + " { " + join(namedBits, ", ") + " }";
    }
}
