package info.isaksson.erland.asn1sema.model;

import java.util.List;

public final class NumberForm extends SemaNode {
    public final String value;

    public NumberForm(String value) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.value = value;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.NUMBER_FORM;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return value;
    }
}
