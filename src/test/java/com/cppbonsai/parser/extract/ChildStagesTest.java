package com.cppbonsai.parser.extract;

import org.junit.jupiter.api.Test;

import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.fixture.FixtureCursor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ChildStages.
 */
class ChildStagesTest {

    @Test
    void testStagesConsumeInOrder() {
        FixtureCursor function = FixtureCursor.of(CursorKind.FUNCTION_DECL)
                .child(FixtureCursor.of(CursorKind.CXX_FINAL_ATTR).build())
                .child(FixtureCursor.of(CursorKind.ANNOTATE_ATTR).spelling("hot").build())
                .child(FixtureCursor.of(CursorKind.PARM_DECL).spelling("a").build())
                .child(FixtureCursor.of(CursorKind.COMPOUND_STMT).build())
                .build();
        ChildStages stages = ChildStages.of(function);

        assertThat(stages.takeWhile(c -> c.getKind().isAttribute())).hasSize(2);
        assertThat(stages.consumed()).isEqualTo(2);
        assertThat(stages.takeWhile(c -> c.getKind().isAttribute())).isEmpty();
        assertThat(stages.peek()).map(c -> c.getSpelling()).contains("a");
        assertThat(stages.next()).map(c -> c.getSpelling()).contains("a");
        assertThat(stages.rest()).extracting(c -> c.getKind()).containsExactly(CursorKind.COMPOUND_STMT);
        assertThat(stages.hasNext()).isFalse();
        assertThat(stages.next()).isEmpty();
        assertThat(stages.peek()).isEmpty();
        assertThat(stages.size()).isEqualTo(4);
    }

    @Test
    void testAttributeLabels() {
        assertThat(Attributes.label(FixtureCursor.of(CursorKind.CXX_FINAL_ATTR).build())).isEqualTo("final");
        assertThat(Attributes.label(FixtureCursor.of(CursorKind.WARN_UNUSED_RESULT_ATTR).build()))
                .isEqualTo("nodiscard");
        assertThat(Attributes.label(FixtureCursor.of(CursorKind.ANNOTATE_ATTR).spelling("hot").build()))
                .isEqualTo("hot");
        assertThat(Attributes.label(FixtureCursor.of(CursorKind.UNEXPOSED_ATTR).build()))
                .isEqualTo("unexposed_attr");
    }
}
