package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * One member of a SEQUENCE, SET or CHOICE.
 *
 * <p>Either a named member (plain, {@code OPTIONAL} or {@code DEFAULT value}) or a
 * {@code COMPONENTS OF Type} inclusion. Use the factory methods; OPTIONAL and DEFAULT
 * cannot be combined.</p>
 */
public final class ComponentType extends SemaNode {
    /** Null for COMPONENTS OF. */
    public final String identifier;
    /** Null for COMPONENTS OF. */
    public final TypeDeclaration typeDecl;
    public final boolean optional;
    /** Null unless declared with DEFAULT. */
    public final SemaNode defaultValue;
    /** Non-null only for COMPONENTS OF. */
    public final TypeDeclaration componentsOfType;

    private ComponentType(String identifier,
                          TypeDeclaration typeDecl,
                          boolean optional,
                          SemaNode defaultValue,
                          TypeDeclaration componentsOfType) {
        this.identifier = identifier;
        this.typeDecl = typeDecl;
        this.optional = optional;
        this.defaultValue = defaultValue;
        this.componentsOfType = componentsOfType;
    }

    public static ComponentType named(NamedType member) {
        if (member == null) throw new IllegalArgumentException("member must not be null");
        return new ComponentType(member.identifier, member.typeDecl, false, null, null);
    }

    public static ComponentType optional(NamedType member) {
        if (member == null) throw new IllegalArgumentException("member must not be null");
        return new ComponentType(member.identifier, member.typeDecl, true, null, null);
    }

    public static ComponentType withDefault(NamedType member, SemaNode defaultValue) {
        if (member == null) throw new IllegalArgumentException("member must not be null");
        if (defaultValue == null) throw new IllegalArgumentException("defaultValue must not be null");
        return new ComponentType(member.identifier, member.typeDecl, false, defaultValue, null);
    }

    public static ComponentType componentsOf(TypeDeclaration included) {
        if (included == null) throw new IllegalArgumentException("included must not be null");
        return new ComponentType(null, null, false, null, included);
    }

    public boolean isComponentsOf() {
        return componentsOfType != null;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.COMPONENT_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return nodes(typeDecl, defaultValue, componentsOfType);
    }

    @Override
    public String toString() {
        if (componentsOfType != null) {
            return "COMPONENTS OF " + componentsOfType;
        }
        String result = identifier + " " + typeDecl;
        if (optional) {
            result += " OPTIONAL";
        } else if (defaultValue != null) {
            result += " DEFAULT " + defaultValue;
        }
        return result;
    }
}
