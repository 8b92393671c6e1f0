package info.isaksson.erland.asn1sema.parsetree;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Closed vocabulary of ASN.1 grammar productions understood by the semantic model builder.
 *
 * <p>Each constant carries the tag used by the parser (and in parse-tree JSON). Some productions
 * produce a semantic node of their own; the others only appear nested inside such productions
 * and are consumed by their parent's constructor.</p>
 */
public enum ProductionKind {
    MODULE_DEFINITION("ModuleDefinition", true),
    TYPE_ASSIGNMENT("TypeAssignment", true),
    VALUE_ASSIGNMENT("ValueAssignment", true),
    COMPONENT_TYPE("ComponentType", true),
    NAMED_TYPE("NamedType", true),
    VALUE_LIST_TYPE("ValueListType", true),
    BIT_STRING_TYPE("BitStringType", true),
    NAMED_VALUE("NamedValue", true),
    TYPE("Type", true),
    SIMPLE_TYPE("SimpleType", true),
    REFERENCED_TYPE("ReferencedType", true),
    REFERENCED_VALUE("ReferencedValue", true),
    TAGGED_TYPE("TaggedType", true),
    SEQUENCE_TYPE("SequenceType", true),
    CHOICE_TYPE("ChoiceType", true),
    SET_TYPE("SetType", true),
    SEQUENCE_OF_TYPE("SequenceOfType", true),
    SET_OF_TYPE("SetOfType", true),
    EXTENSION_MARKER("ExtensionMarker", true),
    CONSTRAINT("Constraint", true),
    SIZE_CONSTRAINT("SizeConstraint", true),
    OBJECT_IDENTIFIER_VALUE("ObjectIdentifierValue", true),
    NAME_FORM("NameForm", true),
    NUMBER_FORM("NumberForm", true),
    NAME_AND_NUMBER_FORM("NameAndNumberForm", true),
    BINARY_STRING_VALUE("BinaryStringValue", true),
    HEX_STRING_VALUE("HexStringValue", true),

    // Structural productions: only valid nested inside the productions above.
    MODULE_REFERENCE("ModuleReference", false),
    MODULE_BODY("ModuleBody", false),
    EXPORTS("Exports", false),
    IMPORTS("Imports", false),
    ASSIGNMENT_LIST("AssignmentList", false),
    IDENTIFIER("Identifier", false),
    TAG("Tag", false),
    TAG_CLASS("TagClass", false),
    TAG_CLASS_NUMBER("TagClassNumber", false),
    COMPONENT_TYPE_OPTIONAL("ComponentTypeOptional", false),
    COMPONENT_TYPE_DEFAULT("ComponentTypeDefault", false),
    COMPONENT_TYPE_COMPONENTS_OF("ComponentTypeComponentsOf", false),
    VALUE("Value", false);

    private static final Map<String, ProductionKind> BY_TAG = indexByTag();

    private final String tag;
    private final boolean semantic;

    ProductionKind(String tag, boolean semantic) {
        this.tag = tag;
        this.semantic = semantic;
    }

    /** Grammar tag as emitted by the parser, e.g. {@code TaggedType}. */
    public String tag() {
        return tag;
    }

    /** True when a node of this kind maps to a semantic node of its own. */
    public boolean isSemantic() {
        return semantic;
    }

    /**
     * Map a parser tag to its production.
     *
     * @throws UnknownNodeKindException if the tag is not part of the vocabulary
     */
    public static ProductionKind fromTag(String tag) {
        ProductionKind kind = tag == null ? null : BY_TAG.get(tag);
        if (kind == null) {
            throw new UnknownNodeKindException(tag);
        }
        return kind;
    }

    private static Map<String, ProductionKind> indexByTag() {
        Map<String, ProductionKind> m = new HashMap<>();
        for (ProductionKind k : values()) {
            m.put(k.tag, k);
        }
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return tag;
    }
}
