package info.isaksson.erland.asn1sema.parsetree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProductionKindTest {

    @Test
    void fromTag_mapsGrammarTags() {
        assertEquals(ProductionKind.TAGGED_TYPE, ProductionKind.fromTag("TaggedType"));
        assertEquals(ProductionKind.OBJECT_IDENTIFIER_VALUE, ProductionKind.fromTag("ObjectIdentifierValue"));
        assertEquals(ProductionKind.COMPONENT_TYPE_COMPONENTS_OF, ProductionKind.fromTag("ComponentTypeComponentsOf"));
    }

    @Test
    void everyKind_roundTripsThroughItsTag() {
        for (ProductionKind k : ProductionKind.values()) {
            assertSame(k, ProductionKind.fromTag(k.tag()));
        }
    }

    @Test
    void fromTag_rejectsUnknownTags() {
        UnknownNodeKindException ex = assertThrows(UnknownNodeKindException.class,
                () -> ProductionKind.fromTag("ObjectClassAssignment"));
        assertEquals("ObjectClassAssignment", ex.tag());

        assertThrows(UnknownNodeKindException.class, () -> ProductionKind.fromTag(null));
        // Tags are case sensitive.
        assertThrows(UnknownNodeKindException.class, () -> ProductionKind.fromTag("taggedtype"));
    }

    @Test
    void structuralKinds_areNotSemantic() {
        assertTrue(ProductionKind.SEQUENCE_TYPE.isSemantic());
        assertTrue(ProductionKind.TYPE.isSemantic());
        assertFalse(ProductionKind.IDENTIFIER.isSemantic());
        assertFalse(ProductionKind.TAG_CLASS_NUMBER.isSemantic());
        assertFalse(ProductionKind.MODULE_BODY.isSemantic());
    }
}
