package info.isaksson.erland.asn1sema.model;

/**
 * Capability of nodes that stand for a named type or value: either the definition itself
 * (assignments) or a use of a name defined elsewhere (referenced types and values, OID name forms).
 *
 * <p>Query the capability with {@code instanceof}; most node kinds do not implement it.</p>
 */
public interface Reference {

    /** The defined or referenced name. */
    String referenceName();
}
