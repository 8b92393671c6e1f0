package info.isaksson.erland.asn1sema.model;

public final class SetOfType extends CollectionType {

    public SetOfType(SizeConstraint sizeConstraint, TypeDeclaration typeDecl) {
        super("SET", sizeConstraint, typeDecl);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SET_OF_TYPE;
    }
}
