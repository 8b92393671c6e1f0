package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** Base type for SET OF and SEQUENCE OF. */
public abstract class CollectionType extends TypeDeclaration {
    /** {@code SEQUENCE} or {@code SET}. */
    public final String collectionKind;
    /** Optional SIZE constraint; null when absent. */
    public final SizeConstraint sizeConstraint;
    /** Element type. */
    public final TypeDeclaration typeDecl;

    CollectionType(String collectionKind, SizeConstraint sizeConstraint, TypeDeclaration typeDecl) {
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        this.collectionKind = collectionKind;
        this.sizeConstraint = sizeConstraint;
        this.typeDecl = typeDecl;
    }

    @Override
    public String typeName() {
        return collectionKind + " OF";
    }

    @Override
    public List<SemaNode> children() {
        return nodes(sizeConstraint, typeDecl);
    }

    @Override
    public String toString() {
        if (sizeConstraint != null) {
            return collectionKind + " " + sizeConstraint + " OF " + typeDecl;
        }
        return collectionKind + " OF " + typeDecl;
    }
}
