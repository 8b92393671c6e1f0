package info.isaksson.erland.asn1sema.core;

/** How {@link Asn1SemaService} orders each module's assignments. */
public enum OrderingMode {
    /** Plain topological sort; fails on reference cycles. */
    TOPOLOGICAL,
    /** Strongly connected components; tolerates cycles. */
    DEPENDENCY
}
