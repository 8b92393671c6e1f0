package info.isaksson.erland.asn1sema.model;

import java.util.List;

public final class ReferencedValue extends SemaNode implements Reference {
    public final String name;

    public ReferencedValue(String name) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
    }

    @Override
    public String referenceName() {
        return name;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.REFERENCED_VALUE;
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
