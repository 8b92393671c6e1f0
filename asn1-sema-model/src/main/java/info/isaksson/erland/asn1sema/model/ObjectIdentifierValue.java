package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code { iso member-body(2) 840 }}: an ordered list of name, number and name-and-number forms. */
public final class ObjectIdentifierValue extends SemaNode {
    public final List<SemaNode> components;

    public ObjectIdentifierValue(List<? extends SemaNode> components) {
        this.components = components == null ? List.of() : List.copyOf(components);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.OBJECT_IDENTIFIER_VALUE;
    }

    @Override
    public List<SemaNode> children() {
        return components;
    }

    @Override
    public String toString() {
        return "{" + join(components, " ") + "}";
    }
}
