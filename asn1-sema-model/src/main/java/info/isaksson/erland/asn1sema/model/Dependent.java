package info.isaksson.erland.asn1sema.model;

import java.util.Set;

/**
 * A named definition together with the names it depends on. This is the shape the ordering
 * algorithms work on.
 */
public interface Dependent extends Reference {

    /** Names this definition refers to. May contain its own name when it is self-recursive. */
    Set<String> references();
}
