package info.isaksson.erland.asn1sema.model;

/**
 * A node that declares a type: built-in, constructed, collection, tagged, enumerated, bit string
 * or a reference to a user-defined type.
 */
public abstract class TypeDeclaration extends SemaNode {

    TypeDeclaration() {}

    /**
     * Name of the declared type as written, e.g. {@code INTEGER}, {@code SEQUENCE},
     * {@code SEQUENCE OF} or a referenced type name.
     */
    public abstract String typeName();
}
