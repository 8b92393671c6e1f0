package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * A type with an explicit tag, e.g. {@code [APPLICATION 3] IMPLICIT OCTET STRING}.
 *
 * <p>{@link #implicit} is true only when the source says {@code IMPLICIT}; both an absent keyword
 * and {@code EXPLICIT} leave it false.</p>
 */
public final class TaggedType extends TypeDeclaration {
    /** Tag class ({@code UNIVERSAL}, {@code APPLICATION}, {@code PRIVATE}); null for context-specific tags. */
    public final String className;
    public final String classNumber;
    public final boolean implicit;
    public final TypeDeclaration typeDecl;

    public TaggedType(String className, String classNumber, boolean implicit, TypeDeclaration typeDecl) {
        if (classNumber == null) throw new IllegalArgumentException("classNumber must not be null");
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        this.className = className;
        this.classNumber = classNumber;
        this.implicit = implicit;
        this.typeDecl = typeDecl;
    }

    /** Name of the tagged type. */
    @Override
    public String typeName() {
        return typeDecl.typeName();
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.TAGGED_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(typeDecl);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        if (className != null) sb.append(className).append(' ');
        sb.append(classNumber).append("] ");
        if (implicit) sb.append("IMPLICIT ");
        return sb.append(typeDecl).toString();
    }
}
