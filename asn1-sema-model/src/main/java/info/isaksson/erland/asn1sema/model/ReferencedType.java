package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * Use of a type defined elsewhere, optionally qualified with a module name
 * ({@code Other-Module.Type}). Module qualifiers are recorded but not resolved.
 */
public final class ReferencedType extends TypeDeclaration implements Reference {
    /** Null for unqualified references. */
    public final String moduleReference;
    public final String typeName;

    public ReferencedType(String moduleReference, String typeName) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        this.moduleReference = moduleReference;
        this.typeName = typeName;
    }

    public ReferencedType(String typeName) {
        this(null, typeName);
    }

    @Override
    public String referenceName() {
        return typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.REFERENCED_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        if (moduleReference == null) return typeName;
        return moduleReference + "." + typeName;
    }
}
