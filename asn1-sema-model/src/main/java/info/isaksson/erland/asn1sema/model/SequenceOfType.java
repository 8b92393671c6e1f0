package info.isaksson.erland.asn1sema.model;

public final class SequenceOfType extends CollectionType {

    public SequenceOfType(SizeConstraint sizeConstraint, TypeDeclaration typeDecl) {
        super("SEQUENCE", sizeConstraint, typeDecl);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SEQUENCE_OF_TYPE;
    }
}
