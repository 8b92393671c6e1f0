package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code name Type ::= value} */
public final class ValueAssignment extends Assignment {
    public final String valueName;
    public final TypeDeclaration typeDecl;
    /** The assigned value; raw literals are held as {@link LiteralValue}. */
    public final SemaNode value;

    public ValueAssignment(String valueName, TypeDeclaration typeDecl, SemaNode value) {
        if (valueName == null) throw new IllegalArgumentException("valueName must not be null");
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.valueName = valueName;
        this.typeDecl = typeDecl;
        this.value = value;
    }

    @Override
    public String referenceName() {
        return valueName;
    }

    @Override
    public TypeDeclaration typeDecl() {
        return typeDecl;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.VALUE_ASSIGNMENT;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(typeDecl, value);
    }

    @Override
    public String toString() {
        return valueName + " " + typeDecl + " ::= " + value;
    }
}
