package org.finos.legend.dsl.schema;

import org.finos.legend.dsl.GrammarException;
import org.finos.legend.dsl.kind.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.finos.legend.dsl.SchoolFixtures.STUDENT_SCHEMA;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Schema Tests")
class SchemaTest {

    @Test
    @DisplayName("Fields are found by key or by name")
    void testLookup() {
        assertEquals(List.of("surname", "dob", "level", "score", "school"), STUDENT_SCHEMA.keys());
        assertEquals(Field.of(Kind.Primitive.INTEGER, "class"), STUDENT_SCHEMA.get("level"));
        assertEquals(Field.of(Kind.Primitive.INTEGER, "class"), STUDENT_SCHEMA.get("class"));
        assertEquals("surname", STUDENT_SCHEMA.get("surname").name());
        assertTrue(STUDENT_SCHEMA.contains("class"));
        assertFalse(STUDENT_SCHEMA.contains("name"));
    }

    @Test
    @DisplayName("Unknown field")
    void testUnknownField() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> STUDENT_SCHEMA.get("name"));
        assertEquals("Unknown field name in schema student", e.getMessage());
    }

    @Test
    @DisplayName("Equality is structural and ignores the schema name")
    void testEquality() {
        Schema first = Schema.builder("first")
                .field("a", Kind.Primitive.INTEGER)
                .field("b", Kind.Primitive.STRING)
                .build();
        Schema second = Schema.builder("second")
                .field("x", Kind.Primitive.INTEGER, "a")
                .field("y", Kind.Primitive.STRING, "b")
                .build();
        Schema swapped = Schema.builder("first")
                .field("b", Kind.Primitive.STRING)
                .field("a", Kind.Primitive.INTEGER)
                .build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, swapped);
    }

    @Test
    @DisplayName("Two keys cannot share a field name")
    void testCollision() {
        Schema.Builder builder = Schema.builder("broken")
                .field("a", Kind.Primitive.INTEGER)
                .field("b", Kind.Primitive.STRING, "c");

        GrammarException e = assertThrows(GrammarException.class,
                () -> builder.field("c", Kind.Primitive.FLOAT));
        assertTrue(e.getMessage().startsWith("Colliding field name c"));
    }

    @Test
    @DisplayName("Redefining a key overrides its field")
    void testOverride() {
        Schema schema = Schema.builder("override")
                .field("a", Kind.Primitive.INTEGER)
                .field("a", Kind.Primitive.FLOAT)
                .build();

        assertEquals(1, schema.size());
        assertEquals(Kind.Primitive.FLOAT, schema.get("a").kind());
    }

    @Test
    @DisplayName("Derived schemas inherit their base fields")
    void testInheritance() {
        Schema derived = Schema.builder("derived", STUDENT_SCHEMA)
                .field("level", Kind.Primitive.STRING, "class")
                .field("nickname", Kind.Primitive.STRING)
                .build();

        assertEquals(List.of("surname", "dob", "level", "score", "school", "nickname"), derived.keys());
        assertEquals(Kind.Primitive.STRING, derived.get("class").kind());
    }

    @Test
    @DisplayName("Anonymous fields are keyed by position")
    void testAnonymous() {
        Schema schema = Schema.of("anonymous", Arrays.asList(Field.of(Kind.Primitive.INTEGER),
                Field.of(Kind.Primitive.STRING, "name")));

        assertEquals(List.of("_0", "name"), schema.keys());
        assertEquals("_0", schema.get("_0").name());
    }
}
