package com.cppbonsai.cst;

import org.junit.jupiter.api.Test;

import com.cppbonsai.cst.fixture.FixtureCursor;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the cursor helpers.
 */
class CursorsTest {

    @Test
    void testUnwrapStripsNestedWrappers() {
        FixtureCursor literal = FixtureCursor.of(CursorKind.INTEGER_LITERAL).spelling("1").build();
        FixtureCursor paren = FixtureCursor.of(CursorKind.PAREN_EXPR).child(literal).build();
        FixtureCursor implicit = FixtureCursor.of(CursorKind.UNEXPOSED_EXPR).child(paren).build();

        assertThat(Cursors.unwrap(implicit)).isSameAs(literal);
        assertThat(Cursors.sameConstruct(implicit, literal)).isTrue();
        assertThat(Cursors.sameConstruct(literal, paren)).isTrue();
    }

    @Test
    void testUnwrapKeepsWrappersWithSeveralChildren() {
        FixtureCursor a = FixtureCursor.of(CursorKind.INTEGER_LITERAL).build();
        FixtureCursor b = FixtureCursor.of(CursorKind.INTEGER_LITERAL).build();
        FixtureCursor wrapper = FixtureCursor.of(CursorKind.UNEXPOSED_EXPR).child(a).child(b).build();

        assertThat(Cursors.unwrap(wrapper)).isSameAs(wrapper);
        assertThat(Cursors.sameConstruct(a, b)).isFalse();
    }

    @Test
    void testReferencedNamePrefersResolvedDeclaration() {
        FixtureCursor base = FixtureCursor.of(CursorKind.CLASS_DECL).spelling("Base").build();
        FixtureCursor resolved = FixtureCursor.of(CursorKind.TYPE_REF).spelling("class N::Base").referenced(base).build();
        FixtureCursor unresolved = FixtureCursor.of(CursorKind.TYPE_REF).spelling("class N::Other").build();

        assertThat(Cursors.referencedName(resolved)).isEqualTo("Base");
        assertThat(Cursors.referencedName(unresolved)).isEqualTo("Other");
    }

    @Test
    void testStripTypeKeyword() {
        assertThat(Cursors.stripTypeKeyword("struct S")).isEqualTo("S");
        assertThat(Cursors.stripTypeKeyword("N::Base")).isEqualTo("N::Base");
        assertThat(Cursors.stripTypeKeyword(null)).isEmpty();
    }

    @Test
    void testSafeLocationWhenAccessorFails() {
        Cursor cursor = mock(Cursor.class);
        when(cursor.getKind()).thenReturn(CursorKind.VAR_DECL);
        when(cursor.getKindName()).thenReturn("VAR_DECL");
        when(cursor.getSpelling()).thenReturn("v");
        when(cursor.getLocation()).thenThrow(new CursorAccessException("no location"));

        assertThat(Cursors.safeLocation(cursor)).isEmpty();
    }

    @Test
    void testSafeLocationDropsLocationsWithoutFile() {
        FixtureCursor synthesized = FixtureCursor.of(CursorKind.VAR_DECL)
                .location(new CursorLocation(null, 3, 4))
                .build();

        assertThat(Cursors.safeLocation(synthesized)).isEmpty();
    }

    @Test
    void testUnknownKindNamesAreUnrecognized() {
        assertThat(CursorKind.fromName("OMP_PARALLEL_DIRECTIVE")).isEqualTo(CursorKind.UNRECOGNIZED);
        assertThat(CursorKind.fromName("call_expr")).isEqualTo(CursorKind.CALL_EXPR);
    }
}
