package info.isaksson.erland.asn1sema.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Base type for SEQUENCE, SET and CHOICE.
 *
 * <p>{@link #components} keeps the members in source order. Besides {@link ComponentType} it may
 * hold {@link NamedType} (CHOICE alternatives) and {@link ExtensionMarker} entries.</p>
 */
public abstract class ConstructedType extends TypeDeclaration {
    public final String typeName;
    public final List<SemaNode> components;

    ConstructedType(String typeName, List<? extends SemaNode> components) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        this.typeName = typeName;
        this.components = components == null ? List.of() : List.copyOf(components);
    }

    @Override
    public String typeName() {
        return typeName;
    }

    /** Members that are component types, skipping extension markers and bare named types. */
    public List<ComponentType> componentTypes() {
        List<ComponentType> out = new ArrayList<>();
        for (SemaNode n : components) {
            if (n instanceof ComponentType) out.add((ComponentType) n);
        }
        return out;
    }

    public boolean isExtensible() {
        for (SemaNode n : components) {
            if (n instanceof ExtensionMarker) return true;
        }
        return false;
    }

    @Override
    public List<SemaNode> children() {
        return components;
    }

    @Override
    public String toString() {
        if (components.isEmpty()) return typeName + " { }";
        return typeName + " { " + join(components, ", ") + " }";
    }
}
