package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** OID component {@code name(number)}, e.g. {@code member-body(2)}. */
public final class NameAndNumberForm extends SemaNode {
    public final NameForm name;
    public final NumberForm number;

    public NameAndNumberForm(NameForm name, NumberForm number) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        if (number == null) throw new IllegalArgumentException("number must not be null");
        this.name = name;
        this.number = number;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.NAME_AND_NUMBER_FORM;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(name, number);
    }

    @Override
    public String toString() {
        return name + "(" + number + ")";
    }
}
