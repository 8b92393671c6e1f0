package info.isaksson.erland.asn1sema.model;

import java.util.List;

public final class ChoiceType extends ConstructedType {

    public ChoiceType(String typeName, List<? extends SemaNode> components) {
        super(typeName, components);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.CHOICE_TYPE;
    }
}
