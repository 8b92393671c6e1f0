package info.isaksson.erland.asn1sema.model;

import java.util.List;

/**
 * Type resolution ran into a chain of plain type aliases that leads back to itself
 * ({@code A ::= B}, {@code B ::= A}) with no structural type to stop at.
 */
public class RecursiveAliasException extends IllegalStateException {

    private final String moduleName;
    private final List<String> chain;

    public RecursiveAliasException(String moduleName, List<String> chain) {
        super("Recursive type alias in module " + moduleName + ": " + String.join(" -> ", chain));
        this.moduleName = moduleName;
        this.chain = List.copyOf(chain);
    }

    public String moduleName() {
        return moduleName;
    }

    /** Visited names in resolution order; the last entry repeats an earlier one. */
    public List<String> chain() {
        return chain;
    }
}
