package info.isaksson.erland.asn1sema.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** A top-level named definition in a module. */
public abstract class Assignment extends SemaNode implements Dependent {

    Assignment() {}

    /** Declared type of the definition. For a value assignment this is the value's type. */
    public abstract TypeDeclaration typeDecl();

    /**
     * All type and value names this assignment depends on: the reference names of every
     * descendant implementing {@link Reference}, in first-seen order.
     */
    @Override
    public Set<String> references() {
        Set<String> out = new LinkedHashSet<>();
        for (SemaNode d : descendants()) {
            if (d instanceof Reference) {
                out.add(((Reference) d).referenceName());
            }
        }
        return Collections.unmodifiableSet(out);
    }

    /** True when the definition mentions its own name, directly or through nested members. */
    public boolean isSelfReferential() {
        return references().contains(referenceName());
    }
}
