package info.isaksson.erland.asn1sema.model;

import java.util.List;

public final class SequenceType extends ConstructedType {

    public SequenceType(String typeName, List<? extends SemaNode> components) {
        super(typeName, components);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SEQUENCE_TYPE;
    }
}
