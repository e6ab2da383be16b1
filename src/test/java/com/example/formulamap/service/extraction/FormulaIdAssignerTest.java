package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaIdAssignerTest {

    @Test
    void namespacesStaySeparateAndCollisionsAreSuffixed() {
        List<FormulaCandidate> candidates = List.of(
            candidate(FormulaType.EQUATION, "(1)"),
            candidate(FormulaType.INLINE, null),
            candidate(FormulaType.DISPLAY, null),
            candidate(FormulaType.EQUATION, "(1)"),
            candidate(FormulaType.DISPLAY, null));

        List<String> ids = new FormulaIdAssigner().assign(candidates);

        assertThat(ids).containsExactly("eq1", "inline_1", "eq1_u", "eq1_2", "eq2");
        assertThat(ids).doesNotHaveDuplicates();
    }

    @Test
    void numberPunctuationIsStripped() {
        assertThat(FormulaIdAssigner.numberedBase("(2.3)")).isEqualTo("eq23");
    }

    @Test
    void sameInputGivesSameIds() {
        List<FormulaCandidate> candidates = List.of(
            candidate(FormulaType.DISPLAY, null),
            candidate(FormulaType.EQUATION, "(4)"),
            candidate(FormulaType.INLINE, null));

        assertThat(new FormulaIdAssigner().assign(candidates))
            .isEqualTo(new FormulaIdAssigner().assign(candidates));
    }

    private static FormulaCandidate candidate(FormulaType type, String number) {
        return new FormulaCandidate("x = y", type, number, "", 0);
    }
}
