package info.isaksson.erland.asn1sema.model;

/**
 * One constant per semantic node variant. Consumers switch on this instead of probing classes.
 */
public enum SemaNodeKind {
    MODULE,
    TYPE_ASSIGNMENT,
    VALUE_ASSIGNMENT,
    SEQUENCE_TYPE,
    SET_TYPE,
    CHOICE_TYPE,
    SEQUENCE_OF_TYPE,
    SET_OF_TYPE,
    TAGGED_TYPE,
    SIMPLE_TYPE,
    REFERENCED_TYPE,
    REFERENCED_VALUE,
    CONSTRAINT,
    SIZE_CONSTRAINT,
    COMPONENT_TYPE,
    NAMED_TYPE,
    VALUE_LIST_TYPE,
    BIT_STRING_TYPE,
    NAMED_VALUE,
    EXTENSION_MARKER,
    NAME_FORM,
    NUMBER_FORM,
    NAME_AND_NUMBER_FORM,
    OBJECT_IDENTIFIER_VALUE,
    BINARY_STRING_VALUE,
    HEX_STRING_VALUE,
    LITERAL_VALUE
}
