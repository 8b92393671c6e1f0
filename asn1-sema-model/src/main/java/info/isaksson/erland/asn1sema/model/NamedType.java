package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** Identifier and type pair. Anonymous members get a generated placeholder identifier. */
public final class NamedType extends SemaNode {
    public final String identifier;
    public final TypeDeclaration typeDecl;

    public NamedType(String identifier, TypeDeclaration typeDecl) {
        if (identifier == null) throw new IllegalArgumentException("identifier must not be null");
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        this.identifier = identifier;
        this.typeDecl = typeDecl;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.NAMED_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(typeDecl);
    }

    @Override
    public String toString() {
        return identifier + " " + typeDecl;
    }
}
