package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * OID component given by name only, e.g. {@code iso}. The name refers to a value defined elsewhere
 * or to a registered arc (see {@link RegisteredOidNames}).
 */
public final class NameForm extends SemaNode implements Reference {
    public final String name;

    public NameForm(String name) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
    }

    @Override
    public String referenceName() {
        return name;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.NAME_FORM;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
