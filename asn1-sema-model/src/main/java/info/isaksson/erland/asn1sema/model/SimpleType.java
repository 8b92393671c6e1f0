package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** A built-in type such as {@code INTEGER}, optionally with a value range. */
public final class SimpleType extends TypeDeclaration {
    public final String typeName;
    /** Null when unconstrained. */
    public final Constraint constraint;

    public SimpleType(String typeName, Constraint constraint) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        this.typeName = typeName;
        this.constraint = constraint;
    }

    public SimpleType(String typeName) {
        this(typeName, null);
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SIMPLE_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return nodes(constraint);
    }

    @Override
    public String toString() {
        if (constraint == null) return typeName;
        return typeName + " " + constraint;
    }
}
