package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** {@code Name ::= Type} */
public final class TypeAssignment extends Assignment {
    public final String typeName;
    public final TypeDeclaration typeDecl;

    public TypeAssignment(String typeName, TypeDeclaration typeDecl) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        this.typeName = typeName;
        this.typeDecl = typeDecl;
    }

    @Override
    public String referenceName() {
        return typeName;
    }

    @Override
    public TypeDeclaration typeDecl() {
        return typeDecl;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.TYPE_ASSIGNMENT;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(typeDecl);
    }

    @Override
    public String toString() {
        return typeName + " ::= " + typeDecl;
    }
}
