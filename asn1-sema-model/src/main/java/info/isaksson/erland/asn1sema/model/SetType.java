package info.isaksson.erland.asn1sema.model;

import java.util.List;

public final class SetType extends ConstructedType {

    public SetType(String typeName, List<? extends SemaNode> components) {
        super(typeName, components);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SET_TYPE;
    }
}
