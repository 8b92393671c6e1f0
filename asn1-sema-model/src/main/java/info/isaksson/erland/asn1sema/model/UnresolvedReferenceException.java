package info.isaksson.erland.asn1sema.model;

/** A referenced type name has no type assignment in the module used for resolution. */
public class UnresolvedReferenceException extends IllegalStateException {

    private final String moduleName;
    private final String referenceName;

    public UnresolvedReferenceException(String moduleName, String referenceName) {
        super("Type " + referenceName + " is not defined in module " + moduleName);
        this.moduleName = moduleName;
        this.referenceName = referenceName;
    }

    public String moduleName() {
        return moduleName;
    }

    public String referenceName() {
        return referenceName;
    }
}
