package info.isaksson.erland.asn1sema.build;

import info.isaksson.erland.asn1sema.model.Assignment;
import info.isaksson.erland.asn1sema.model.BinaryStringValue;
import info.isaksson.erland.asn1sema.model.BitStringType;
import info.isaksson.erland.asn1sema.model.ChoiceType;
import info.isaksson.erland.asn1sema.model.ComponentType;
import info.isaksson.erland.asn1sema.model.Constraint;
import info.isaksson.erland.asn1sema.model.ExtensionMarker;
import info.isaksson.erland.asn1sema.model.HexStringValue;
import info.isaksson.erland.asn1sema.model.LiteralValue;
import info.isaksson.erland.asn1sema.model.Module;
import info.isaksson.erland.asn1sema.model.NameAndNumberForm;
import info.isaksson.erland.asn1sema.model.NameForm;
import info.isaksson.erland.asn1sema.model.NamedType;
import info.isaksson.erland.asn1sema.model.NamedValue;
import info.isaksson.erland.asn1sema.model.NumberForm;
import info.isaksson.erland.asn1sema.model.ObjectIdentifierValue;
import info.isaksson.erland.asn1sema.model.ReferencedType;
import info.isaksson.erland.asn1sema.model.ReferencedValue;
import info.isaksson.erland.asn1sema.model.SemaNode;
import info.isaksson.erland.asn1sema.model.SequenceOfType;
import info.isaksson.erland.asn1sema.model.SequenceType;
import info.isaksson.erland.asn1sema.model.SetOfType;
import info.isaksson.erland.asn1sema.model.SetType;
import info.isaksson.erland.asn1sema.model.SimpleType;
import info.isaksson.erland.asn1sema.model.SizeConstraint;
import info.isaksson.erland.asn1sema.model.TaggedType;
import info.isaksson.erland.asn1sema.model.TypeAssignment;
import info.isaksson.erland.asn1sema.model.TypeDeclaration;
import info.isaksson.erland.asn1sema.model.ValueAssignment;
import info.isaksson.erland.asn1sema.model.ValueListType;
import info.isaksson.erland.asn1sema.parsetree.MalformedParseTreeException;
import info.isaksson.erland.asn1sema.parsetree.ParseElement;
import info.isaksson.erland.asn1sema.parsetree.ParseNode;
import info.isaksson.erland.asn1sema.parsetree.ProductionKind;
import info.isaksson.erland.asn1sema.parsetree.UnknownNodeKindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the semantic model from an annotated parse tree in a single bottom-up pass.
 *
 * <p>Every production has one construction method. Each one checks the shape its production
 * guarantees and fails with {@link MalformedParseTreeException} when the tree does not match;
 * the tree is expected to be grammar-valid already, so such failures point at a parser mismatch.</p>
 *
 * <p>A builder is cheap and holds no state besides the unnamed-member sequence it draws
 * placeholder identifiers from.</p>
 */
public final class SemaModelBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SemaModelBuilder.class);

    static final String IMPLICIT = "IMPLICIT";

    private final UnnamedMemberSequence unnamedMembers;

    /** Builder drawing placeholder names from the process-wide shared sequence. */
    public SemaModelBuilder() {
        this(UnnamedMemberSequence.shared());
    }

    public SemaModelBuilder(UnnamedMemberSequence unnamedMembers) {
        if (unnamedMembers == null) throw new IllegalArgumentException("unnamedMembers must not be null");
        this.unnamedMembers = unnamedMembers;
    }

    /**
     * Build one {@link Module} per top-level module definition.
     *
     * @param forest top-level parse nodes; each must be a {@code ModuleDefinition}
     */
    public List<Module> build(List<ParseNode> forest) {
        if (forest == null) throw new IllegalArgumentException("forest must not be null");
        List<Module> modules = new ArrayList<>(forest.size());
        for (ParseNode n : forest) {
            if (n == null || n.kind != ProductionKind.MODULE_DEFINITION) {
                throw new MalformedParseTreeException("Top-level parse nodes must be "
                        + ProductionKind.MODULE_DEFINITION + " but found " + (n == null ? "null" : n.kind));
            }
            modules.add(module(n));
        }
        return modules;
    }

    /**
     * Build the semantic node for a single parse node. {@code Type} wrappers are unwrapped to the
     * production they contain.
     *
     * @throws UnknownNodeKindException if the production has no semantic node of its own
     */
    public SemaNode createNode(ParseNode node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        return switch (node.kind) {
            case MODULE_DEFINITION -> module(node);
            case TYPE_ASSIGNMENT -> typeAssignment(node);
            case VALUE_ASSIGNMENT -> valueAssignment(node);
            case COMPONENT_TYPE -> componentType(node);
            case NAMED_TYPE -> namedType(node);
            case VALUE_LIST_TYPE -> valueListType(node);
            case BIT_STRING_TYPE -> bitStringType(node);
            case NAMED_VALUE -> namedValue(node);
            case TYPE -> createNode(unwrapType(node));
            case SIMPLE_TYPE -> simpleType(node);
            case REFERENCED_TYPE -> referencedType(node);
            case REFERENCED_VALUE -> new ReferencedValue(singleToken(node));
            case TAGGED_TYPE -> taggedType(node);
            case SEQUENCE_TYPE -> new SequenceType(constructedTypeName(node), members(node));
            case CHOICE_TYPE -> new ChoiceType(constructedTypeName(node), members(node));
            case SET_TYPE -> new SetType(constructedTypeName(node), members(node));
            case SEQUENCE_OF_TYPE -> sequenceOfType(node);
            case SET_OF_TYPE -> setOfType(node);
            case EXTENSION_MARKER -> new ExtensionMarker();
            case CONSTRAINT -> constraint(node);
            case SIZE_CONSTRAINT -> sizeConstraint(node);
            case OBJECT_IDENTIFIER_VALUE -> objectIdentifierValue(node);
            case NAME_FORM -> new NameForm(singleToken(node));
            case NUMBER_FORM -> new NumberForm(singleToken(node));
            case NAME_AND_NUMBER_FORM -> nameAndNumberForm(node);
            case BINARY_STRING_VALUE -> new BinaryStringValue(singleToken(node));
            case HEX_STRING_VALUE -> new HexStringValue(singleToken(node));
            case MODULE_REFERENCE, MODULE_BODY, EXPORTS, IMPORTS, ASSIGNMENT_LIST, IDENTIFIER, TAG,
                    TAG_CLASS, TAG_CLASS_NUMBER, COMPONENT_TYPE_OPTIONAL, COMPONENT_TYPE_DEFAULT,
                    COMPONENT_TYPE_COMPONENTS_OF, VALUE ->
                    throw new UnknownNodeKindException(node.kind.tag(),
                            "No semantic node for nested production " + node.kind);
        };
    }

    /** Build a type declaration; the node must produce one. */
    public TypeDeclaration createTypeDecl(ParseNode node) {
        SemaNode n = createNode(node);
        if (!(n instanceof TypeDeclaration)) {
            throw new MalformedParseTreeException("Expected a type declaration from " + node.kind
                    + " but got " + n.kind());
        }
        return (TypeDeclaration) n;
    }

    /** Raw tokens become {@link LiteralValue}s, nodes are built normally. */
    SemaNode createValue(ParseElement element) {
        if (element.isToken()) return new LiteralValue(element.asToken().text);
        if (element.isNode()) return createNode(element.asNode());
        throw new MalformedParseTreeException("Expected a value token or node but found a node sequence");
    }

    private Module module(ParseNode node) {
        node.requireArity(7, 7);
        String name = node.node(0, ProductionKind.MODULE_REFERENCE).tokenText(0);
        ParseNode body = node.node(5, ProductionKind.MODULE_BODY);
        body.requireArity(3, 3);
        ParseNode assignmentList = body.node(2, ProductionKind.ASSIGNMENT_LIST);

        List<Assignment> assignments = new ArrayList<>(assignmentList.size());
        for (ParseElement e : assignmentList.elements) {
            SemaNode n = createNode(e.asNode());
            if (!(n instanceof Assignment)) {
                throw new MalformedParseTreeException("Module " + name + ": expected an assignment but got " + n.kind());
            }
            assignments.add((Assignment) n);
        }
        LOG.debug("Built module {} with {} assignments", name, assignments.size());
        return new Module(name, assignments);
    }

    private TypeAssignment typeAssignment(ParseNode node) {
        node.requireArity(3, 3);
        return new TypeAssignment(node.tokenText(0), typeDeclAt(node, 2));
    }

    private ValueAssignment valueAssignment(ParseNode node) {
        node.requireArity(4, 4);
        return new ValueAssignment(node.tokenText(0), typeDeclAt(node, 1), createValue(node.element(3)));
    }

    private ParseNode unwrapType(ParseNode node) {
        if (node.size() < 1) {
            throw new MalformedParseTreeException(node.kind + " must wrap a more specific type production");
        }
        return node.element(0).asNode();
    }

    private SimpleType simpleType(ParseNode node) {
        node.requireArity(1, 2);
        Constraint constraint = null;
        if (node.size() > 1 && node.element(1).isNode(ProductionKind.CONSTRAINT)) {
            constraint = constraint(node.element(1).asNode());
        }
        return new SimpleType(node.tokenText(0), constraint);
    }

    private ReferencedType referencedType(ParseNode node) {
        node.requireArity(1, 2);
        if (node.size() > 1 && node.element(0).isNode(ProductionKind.MODULE_REFERENCE)) {
            String moduleReference = node.element(0).asNode().tokenText(0);
            return new ReferencedType(moduleReference, node.tokenText(1));
        }
        return new ReferencedType(node.tokenText(0));
    }

    private TaggedType taggedType(ParseNode node) {
        node.requireArity(2, 3);
        ParseNode tag = node.node(0, ProductionKind.TAG);

        boolean implicit = false;
        ParseNode typeNode;
        if (node.element(1).isNode()) {
            if (node.size() != 2) {
                throw new MalformedParseTreeException(node.kind + ": unexpected elements after the tagged type");
            }
            typeNode = node.element(1).asNode();
        } else {
            node.requireArity(3, 3);
            // "EXPLICIT" and absence of a keyword both mean explicit tagging.
            implicit = node.element(1).isToken(IMPLICIT);
            typeNode = node.element(2).asNode();
        }

        String className = null;
        String classNumber = null;
        for (ParseElement e : tag.elements) {
            ParseNode tagElement = e.asNode();
            if (tagElement.kind == ProductionKind.TAG_CLASS_NUMBER) {
                classNumber = tagElement.tokenText(0);
            } else if (tagElement.kind == ProductionKind.TAG_CLASS) {
                className = tagElement.tokenText(0);
            } else {
                throw new MalformedParseTreeException("Unknown tag element: " + tagElement.kind);
            }
        }
        if (classNumber == null) {
            throw new MalformedParseTreeException(node.kind + ": tag has no " + ProductionKind.TAG_CLASS_NUMBER);
        }
        return new TaggedType(className, classNumber, implicit, createTypeDecl(typeNode));
    }

    private String constructedTypeName(ParseNode node) {
        node.requireArity(2, 2);
        return node.tokenText(0);
    }

    private List<SemaNode> members(ParseNode node) {
        List<SemaNode> out = new ArrayList<>();
        for (ParseNode member : node.sequence(1)) {
            SemaNode n = createNode(member);
            if (!(n instanceof ComponentType || n instanceof NamedType || n instanceof ExtensionMarker)) {
                throw new MalformedParseTreeException(node.kind + ": unexpected member " + n.kind());
            }
            out.add(n);
        }
        return out;
    }

    private SequenceOfType sequenceOfType(ParseNode node) {
        CollectionParts parts = collectionParts(node);
        return new SequenceOfType(parts.sizeConstraint, parts.elementType);
    }

    private SetOfType setOfType(ParseNode node) {
        CollectionParts parts = collectionParts(node);
        return new SetOfType(parts.sizeConstraint, parts.elementType);
    }

    /** {@code [Type]} or {@code [SizeConstraint, Type]}; the first element decides. */
    private CollectionParts collectionParts(ParseNode node) {
        ParseElement first = node.element(0);
        if (first.isNode(ProductionKind.TYPE)) {
            node.requireArity(1, 1);
            return new CollectionParts(null, createTypeDecl(first.asNode()));
        }
        if (first.isNode(ProductionKind.SIZE_CONSTRAINT)) {
            node.requireArity(2, 2);
            return new CollectionParts(sizeConstraint(first.asNode()), typeDeclAt(node, 1));
        }
        throw new MalformedParseTreeException("Unknown form of " + node.kind + " declaration: " + node.elements);
    }

    private Constraint constraint(ParseNode node) {
        node.requireArity(2, 2);
        return new Constraint(createValue(node.element(0)), createValue(node.element(1)));
    }

    private SizeConstraint sizeConstraint(ParseNode node) {
        node.requireArity(2, 2);
        return new SizeConstraint(createValue(node.element(0)), createValue(node.element(1)));
    }

    private ComponentType componentType(ParseNode node) {
        node.requireArity(1, 1);
        ParseNode first = node.element(0).asNode();
        switch (first.kind) {
            case NAMED_TYPE:
                return ComponentType.named(namedType(first));
            case COMPONENT_TYPE_OPTIONAL:
                first.requireArity(1, 1);
                return ComponentType.optional(namedType(first.node(0, ProductionKind.NAMED_TYPE)));
            case COMPONENT_TYPE_DEFAULT:
                first.requireArity(2, 2);
                return ComponentType.withDefault(namedType(first.node(0, ProductionKind.NAMED_TYPE)),
                        createValue(first.element(1)));
            case COMPONENT_TYPE_COMPONENTS_OF:
                first.requireArity(1, 1);
                return ComponentType.componentsOf(typeDeclAt(first, 0));
            default:
                throw new MalformedParseTreeException("Unknown component type " + first.kind);
        }
    }

    private NamedType namedType(ParseNode node) {
        node.requireArity(1, 2);
        ParseNode first = node.element(0).asNode();
        if (first.kind == ProductionKind.TYPE) {
            node.requireArity(1, 1);
            String placeholder = unnamedMembers.next();
            LOG.debug("Anonymous member named {}", placeholder);
            return new NamedType(placeholder, createTypeDecl(first));
        }
        if (first.kind == ProductionKind.IDENTIFIER) {
            node.requireArity(2, 2);
            return new NamedType(first.tokenText(0), typeDeclAt(node, 1));
        }
        throw new MalformedParseTreeException(node.kind + " must start with "
                + ProductionKind.IDENTIFIER + " or " + ProductionKind.TYPE + " but found " + first.kind);
    }

    private ValueListType valueListType(ParseNode node) {
        node.requireArity(1, 2);
        String typeName = node.tokenText(0);
        if (node.size() == 1) return new ValueListType(typeName);
        List<SemaNode> values = namedValueList(node);
        try {
            return new ValueListType(typeName, values);
        } catch (IllegalArgumentException e) {
            throw new MalformedParseTreeException(typeName + ": " + e.getMessage(), e);
        }
    }

    private BitStringType bitStringType(ParseNode node) {
        node.requireArity(1, 2);
        String typeName = node.tokenText(0);
        if (node.size() == 1) return new BitStringType(typeName, List.of());
        return new BitStringType(typeName, namedValueList(node));
    }

    private List<SemaNode> namedValueList(ParseNode node) {
        List<SemaNode> out = new ArrayList<>();
        for (ParseNode entry : node.sequence(1)) {
            SemaNode n = createNode(entry);
            if (!(n instanceof NamedValue || n instanceof ExtensionMarker)) {
                throw new MalformedParseTreeException(node.kind + ": unexpected entry " + n.kind());
            }
            out.add(n);
        }
        return out;
    }

    private NamedValue namedValue(ParseNode node) {
        node.requireArity(1, 2);
        if (node.size() == 1) {
            return new NamedValue(node.tokenText(0), null);
        }
        String identifier = node.node(0, ProductionKind.IDENTIFIER).tokenText(0);
        String value = node.element(1).asNode().tokenText(0);
        return new NamedValue(identifier, value);
    }

    private ObjectIdentifierValue objectIdentifierValue(ParseNode node) {
        List<SemaNode> components = new ArrayList<>(node.size());
        for (ParseElement e : node.elements) {
            components.add(createNode(e.asNode()));
        }
        return new ObjectIdentifierValue(components);
    }

    private NameAndNumberForm nameAndNumberForm(ParseNode node) {
        node.requireArity(2, 2);
        NameForm name = new NameForm(singleToken(node.node(0, ProductionKind.NAME_FORM)));
        NumberForm number = new NumberForm(singleToken(node.node(1, ProductionKind.NUMBER_FORM)));
        return new NameAndNumberForm(name, number);
    }

    private TypeDeclaration typeDeclAt(ParseNode node, int index) {
        return createTypeDecl(node.element(index).asNode());
    }

    private static String singleToken(ParseNode node) {
        node.requireArity(1, 1);
        return node.tokenText(0);
    }

    private record CollectionParts(SizeConstraint sizeConstraint, TypeDeclaration elementType) {}
}
