package info.isaksson.erland.asn1sema.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One ASN.1 module: its name and assignments in source order.
 *
 * <p>Also acts as a lookup façade for code generators: {@link #userTypes()} indexes the type
 * assignments by name and {@link #resolveTypeDecl(TypeDeclaration)} follows type aliases down to
 * the underlying declaration.</p>
 */
public final class Module extends SemaNode {
    public final String name;
    public final List<Assignment> assignments;

    // Guarded by this.
    private Map<String, TypeDeclaration> userTypes;

    public Module(String name, List<? extends Assignment> assignments) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
        this.assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    /**
     * Type assignments indexed by name, built on first use. When two assignments share a name the
     * later one wins.
     */
    public synchronized Map<String, TypeDeclaration> userTypes() {
        if (userTypes == null) {
            Map<String, TypeDeclaration> index = new LinkedHashMap<>();
            for (Assignment a : assignments) {
                if (a instanceof TypeAssignment) {
                    TypeAssignment ta = (TypeAssignment) a;
                    index.put(ta.typeName, ta.typeDecl);
                }
            }
            userTypes = Collections.unmodifiableMap(index);
        }
        return userTypes;
    }

    /**
     * Follow user-defined type references until a declaration that is not a {@link ReferencedType}.
     * Any other declaration is returned unchanged.
     *
     * @throws RecursiveAliasException if the alias chain returns to a name already visited
     * @throws UnresolvedReferenceException if a referenced name has no type assignment in this module
     */
    public TypeDeclaration resolveTypeDecl(TypeDeclaration typeDecl) {
        if (typeDecl == null) throw new IllegalArgumentException("typeDecl must not be null");
        Map<String, TypeDeclaration> types = userTypes();

        Set<String> visited = new LinkedHashSet<>();
        TypeDeclaration current = typeDecl;
        while (current instanceof ReferencedType) {
            String referenced = ((ReferencedType) current).typeName;
            if (!visited.add(referenced)) {
                List<String> chain = new ArrayList<>(visited);
                chain.add(referenced);
                throw new RecursiveAliasException(name, chain);
            }
            TypeDeclaration target = types.get(referenced);
            if (target == null) {
                throw new UnresolvedReferenceException(name, referenced);
            }
            current = target;
        }
        return current;
    }

    /** Assignments of the given kind, in source order. */
    public <T extends Assignment> List<T> assignmentsOfType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Assignment a : assignments) {
            if (type.isInstance(a)) out.add(type.cast(a));
        }
        return out;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.MODULE;
    }

    @Override
    public List<SemaNode> children() {
        return List.copyOf(assignments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" DEFINITIONS ::=\n");
        sb.append("BEGIN\n");
        for (Assignment a : assignments) {
            sb.append(a).append('\n');
        }
        sb.append("END\n");
        return sb.toString();
    }
}
