package info.isaksson.erland.asn1sema.build;

import info.isaksson.erland.asn1sema.model.ChoiceType;
import info.isaksson.erland.asn1sema.model.CollectionType;
import info.isaksson.erland.asn1sema.model.ComponentType;
import info.isaksson.erland.asn1sema.model.LiteralValue;
import info.isaksson.erland.asn1sema.model.Module;
import info.isaksson.erland.asn1sema.model.NamedType;
import info.isaksson.erland.asn1sema.model.NamedValue;
import info.isaksson.erland.asn1sema.model.ReferencedType;
import info.isaksson.erland.asn1sema.model.SemaNode;
import info.isaksson.erland.asn1sema.model.SequenceOfType;
import info.isaksson.erland.asn1sema.model.SequenceType;
import info.isaksson.erland.asn1sema.model.SimpleType;
import info.isaksson.erland.asn1sema.model.TaggedType;
import info.isaksson.erland.asn1sema.model.TypeAssignment;
import info.isaksson.erland.asn1sema.model.ValueAssignment;
import info.isaksson.erland.asn1sema.model.ValueListType;
import info.isaksson.erland.asn1sema.parsetree.MalformedParseTreeException;
import info.isaksson.erland.asn1sema.parsetree.ParseNode;
import info.isaksson.erland.asn1sema.parsetree.ParseToken;
import info.isaksson.erland.asn1sema.parsetree.UnknownNodeKindException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static info.isaksson.erland.asn1sema.build.ParseTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class SemaModelBuilderTest {

    private final SemaModelBuilder builder = new SemaModelBuilder(UnnamedMemberSequence.create());

    private static ParseNode tag(String className, String number) {
        return className == null
                ? node("Tag", node("TagClassNumber", number))
                : node("Tag", node("TagClass", className), node("TagClassNumber", number));
    }

    @Test
    void buildsModuleWithAssignmentsInSourceOrder() {
        List<Module> modules = builder.build(List.of(module("Demo",
                typeAssignment("Counter", simple("INTEGER")),
                typeAssignment("Alias", ref("Counter")),
                node("ValueAssignment", "zero", ref("Counter"), "::=", "0"))));

        assertEquals(1, modules.size());
        Module m = modules.get(0);
        assertEquals("Demo", m.name);
        assertEquals(List.of("Counter", "Alias", "zero"),
                m.assignments.stream().map(a -> a.referenceName()).collect(Collectors.toList()));

        ValueAssignment zero = (ValueAssignment) m.assignments.get(2);
        assertTrue(zero.value instanceof LiteralValue);
        assertEquals("zero Counter ::= 0", zero.toString());
        assertEquals(Set.of("Counter"), zero.references());
    }

    @Test
    void topLevelNodesMustBeModules() {
        assertThrows(MalformedParseTreeException.class,
                () -> builder.build(List.of(typeAssignment("X", simple("INTEGER")))));
    }

    @Test
    void moduleWithWrongArity_isMalformed() {
        ParseNode shortModule = node("ModuleDefinition", node("ModuleReference", "M"), "DEFINITIONS");
        assertThrows(MalformedParseTreeException.class, () -> builder.build(List.of(shortModule)));
    }

    @Test
    void typeWrapper_unwrapsToInnerProduction() {
        SemaNode n = builder.createNode(simple("BOOLEAN"));
        assertTrue(n instanceof SimpleType);
        assertEquals("BOOLEAN", n.toString());
    }

    @Test
    void simpleTypeWithConstraint() {
        SimpleType t = (SimpleType) builder.createNode(
                node("SimpleType", "INTEGER", node("Constraint", 0, 255)));

        assertNotNull(t.constraint);
        assertEquals("INTEGER (0..255)", t.toString());
    }

    @Test
    void taggedType_implicitOnlyWhenKeywordSaysSo() {
        TaggedType implicit = (TaggedType) builder.createNode(
                node("TaggedType", tag(null, "2"), "IMPLICIT", simple("INTEGER")));
        TaggedType explicit = (TaggedType) builder.createNode(
                node("TaggedType", tag("APPLICATION", "3"), "EXPLICIT", simple("INTEGER")));
        TaggedType bare = (TaggedType) builder.createNode(
                node("TaggedType", tag("CONTEXT", "0"), ref("Body")));

        assertTrue(implicit.implicit);
        assertNull(implicit.className);
        assertEquals("[2] IMPLICIT INTEGER", implicit.toString());

        assertFalse(explicit.implicit);
        assertEquals("APPLICATION", explicit.className);
        assertEquals("[APPLICATION 3] INTEGER", explicit.toString());

        assertFalse(bare.implicit);
        assertEquals("0", bare.classNumber);
        assertEquals("Body", bare.typeName());
    }

    @Test
    void taggedType_requiresClassNumber() {
        assertThrows(MalformedParseTreeException.class, () -> builder.createNode(
                node("TaggedType", node("Tag", node("TagClass", "PRIVATE")), simple("INTEGER"))));
    }

    @Test
    void collectionTypes_withAndWithoutSize() {
        SequenceOfType sized = (SequenceOfType) builder.createNode(
                node("SequenceOfType", node("SizeConstraint", 1, 10), simple("INTEGER")));
        SemaNode unsized = builder.createNode(node("SetOfType", ref("Item")));

        assertEquals("SEQUENCE SIZE(1..10) OF INTEGER", sized.toString());
        assertEquals("SEQUENCE OF", sized.typeName());
        assertEquals("SET OF Item", unsized.toString());
        assertNotNull(sized.sizeConstraint);
        assertNull(((CollectionType) unsized).sizeConstraint);
    }

    @Test
    void collectionType_unknownShapeIsMalformed() {
        assertThrows(MalformedParseTreeException.class, () -> builder.createNode(
                node("SequenceOfType", node("Constraint", 1, 10), simple("INTEGER"))));
        assertThrows(MalformedParseTreeException.class, () -> builder.createNode(
                node("SequenceOfType", "SEQUENCE", simple("INTEGER"))));
    }

    @Test
    void componentTypes_allFourShapes() {
        SequenceType seq = (SequenceType) builder.createNode(node("SequenceType", "SEQUENCE", List.of(
                component("plain", simple("INTEGER")),
                node("ComponentType", node("ComponentTypeOptional", named("maybe", simple("BOOLEAN")))),
                node("ComponentType", node("ComponentTypeDefault", named("level", simple("INTEGER")), "3")),
                node("ComponentType", node("ComponentTypeComponentsOf", ref("Base"))),
                node("ExtensionMarker"))));

        List<ComponentType> members = seq.componentTypes();
        assertEquals(4, members.size());
        assertFalse(members.get(0).optional);
        assertTrue(members.get(1).optional);
        assertTrue(members.get(2).hasDefault());
        assertTrue(members.get(3).isComponentsOf());
        assertTrue(seq.isExtensible());

        assertEquals("SEQUENCE { plain INTEGER, maybe BOOLEAN OPTIONAL, level INTEGER DEFAULT 3, "
                + "COMPONENTS OF Base, ... }", seq.toString());
    }

    @Test
    void choiceAlternatives_areNamedTypes() {
        ChoiceType choice = (ChoiceType) builder.createNode(node("ChoiceType", "CHOICE", List.of(
                named("number", simple("INTEGER")),
                named("text", simple("UTF8String")))));

        assertTrue(choice.components.get(0) instanceof NamedType);
        assertTrue(choice.componentTypes().isEmpty());
        assertEquals("CHOICE { number INTEGER, text UTF8String }", choice.toString());
    }

    @Test
    void emptyConstructedType_rendersEmptyBraces() {
        assertEquals("SET { }", builder.createNode(node("SetType", "SET", List.of())).toString());
    }

    @Test
    void anonymousMembers_getSequentialPlaceholders() {
        SequenceType seq = (SequenceType) builder.createNode(node("SequenceType", "SEQUENCE", List.of(
                node("ComponentType", node("NamedType", simple("INTEGER"))),
                node("ComponentType", node("NamedType", simple("BOOLEAN"))))));

        assertEquals("unnamed1", seq.componentTypes().get(0).identifier);
        assertEquals("unnamed2", seq.componentTypes().get(1).identifier);
    }

    @Test
    void anonymousMembers_neverRepeatAcrossSharedBuilds() {
        ParseNode anonymous = node("NamedType", simple("INTEGER"));

        NamedType first = (NamedType) new SemaModelBuilder().createNode(anonymous);
        NamedType second = (NamedType) new SemaModelBuilder().createNode(anonymous);

        assertTrue(first.identifier.startsWith("unnamed"));
        assertNotEquals(first.identifier, second.identifier);
    }

    @Test
    void valueList_numbersMissingValues() {
        ValueListType t = (ValueListType) builder.createNode(node("ValueListType", "ENUMERATED", List.of(
                node("NamedValue", "a"),
                node("NamedValue", node("Identifier", "b"), node("Value", "5")),
                node("NamedValue", "c"),
                node("ExtensionMarker"),
                node("NamedValue", "d"))));

        assertEquals(List.of("0", "5", "6", "7"),
                t.values().stream().map(v -> v.value).collect(Collectors.toList()));
        assertEquals("ENUMERATED { a (0), b (5), c (6), ..., d (7) }", t.toString());
    }

    @Test
    void valueList_withoutEntries() {
        ValueListType t = (ValueListType) builder.createNode(node("ValueListType", "ENUMERATED"));
        assertTrue(t.namedValues.isEmpty());
        assertEquals("ENUMERATED", t.toString());
    }

    @Test
    void valueList_nonNumericPredecessorIsMalformed() {
        assertThrows(MalformedParseTreeException.class, () -> builder.createNode(node("ValueListType", "INTEGER", List.of(
                node("NamedValue", node("Identifier", "max"), node("Value", "upper")),
                node("NamedValue", "next")))));
    }

    @Test
    void bitString_keepsNamedBits() {
        SemaNode t = builder.createNode(node("BitStringType", "BIT STRING", List.of(
                node("NamedValue", node("Identifier", "read"), node("Value", "0")),
                node("NamedValue", node("Identifier", "write"), node("Value", "1")))));

        assertEquals("BIT STRING { read (0), write (1) }", t.toString());
        assertTrue(t.descendants().stream().allMatch(d -> d instanceof NamedValue));
    }

    @Test
    void moduleQualifiedReference_keepsModuleName() {
        ReferencedType r = (ReferencedType) builder.createNode(
                node("ReferencedType", node("ModuleReference", "Other"), "Thing"));

        assertEquals("Other", r.moduleReference);
        assertEquals("Thing", r.referenceName());
        assertEquals("Other.Thing", r.toString());
    }

    @Test
    void valuesRenderInAsn1Notation() {
        SemaNode oid = builder.createNode(node("ObjectIdentifierValue",
                node("NameForm", "iso"),
                node("NameAndNumberForm", node("NameForm", "member-body"), node("NumberForm", "2")),
                node("NumberForm", "840")));

        assertEquals("{iso member-body(2) 840}", oid.toString());
        assertEquals("'0101'B", builder.createNode(node("BinaryStringValue", "0101")).toString());
        assertEquals("'CAFE'H", builder.createNode(node("HexStringValue", "CAFE")).toString());
        assertEquals("other", builder.createNode(node("ReferencedValue", "other")).toString());
    }

    @Test
    void rawTokens_becomeLiteralValues() {
        SemaNode v = builder.createValue(ParseToken.of("TRUE"));
        assertTrue(v instanceof LiteralValue);
        assertEquals("TRUE", v.toString());
    }

    @Test
    void structuralProductions_haveNoNodeOfTheirOwn() {
        UnknownNodeKindException ex = assertThrows(UnknownNodeKindException.class,
                () -> builder.createNode(node("Identifier", "x")));
        assertEquals("Identifier", ex.tag());
        assertThrows(UnknownNodeKindException.class, () -> builder.createNode(node("ModuleBody")));
    }

    @Test
    void typeAssignmentOfNonType_isMalformed() {
        assertThrows(MalformedParseTreeException.class,
                () -> builder.createNode(typeAssignment("X", type(node("ExtensionMarker")))));
    }

    @Test
    void builtModule_rendersBackToNotation() {
        Module m = builder.build(List.of(module("Demo",
                typeAssignment("Flag", simple("BOOLEAN")),
                typeAssignment("Pair", type(node("SequenceType", "SEQUENCE", List.of(
                        component("left", ref("Flag")),
                        component("right", ref("Flag"))))))))).get(0);

        assertEquals("Demo DEFINITIONS ::=\n"
                + "BEGIN\n"
                + "Flag ::= BOOLEAN\n"
                + "Pair ::= SEQUENCE { left Flag, right Flag }\n"
                + "END\n", m.toString());
        assertTrue(m.assignments.get(1) instanceof TypeAssignment);
    }
}
