package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LatexFormulaScannerTest {

    private final LatexFormulaScanner scanner = new LatexFormulaScanner();

    @Test
    void numberedDisplayDollars() {
        List<FormulaCandidate> found = scanner.scan("$$y = f(x)$$ (2)");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("y = f(x)");
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.EQUATION);
        assertThat(found.get(0).getNumber()).isEqualTo("(2)");
    }

    @Test
    void proseLineWithNumberMarkerTakesItsOwnContext() {
        List<FormulaCandidate> found = scanner.scan("We define x as the input (1)");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getNumber()).isEqualTo("(1)");
        assertThat(found.get(0).getContext()).isEqualTo("We define x as the input");
    }

    @Test
    void equationEnvironmentDropsLabel() {
        List<FormulaCandidate> found = scanner.scan("\\begin{equation}\nE = mc^2 \\label{eq:energy}\n\\end{equation}");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("E = mc^2");
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.DISPLAY);
        assertThat(found.get(0).getNumber()).isNull();
    }

    @Test
    void bracketBlockWithTagIsNumbered() {
        List<FormulaCandidate> found = scanner.scan("\\[ a + b = c \\tag{3} \\]");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("a + b = c");
        assertThat(found.get(0).getNumber()).isEqualTo("(3)");
    }

    @Test
    void inlineFragmentsNeedMathContent() {
        List<FormulaCandidate> found = scanner.scan("The learning rate $\\alpha = 0.1$ controls the step size of $x$.");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("\\alpha = 0.1");
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.INLINE);
        assertThat(found.get(0).getContext()).contains("learning rate");
    }

    @Test
    void mathOnlyLineUsesPrecedingProse() {
        List<FormulaCandidate> found = scanner.scan("We minimize the following objective.\nL = \\sum_i (y_i - f(x_i))^2");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.DISPLAY);
        assertThat(found.get(0).getContext()).isEqualTo("We minimize the following objective.");
    }

    @Test
    void precedingFormulaLineIsNotContext() {
        List<FormulaCandidate> found = scanner.scan("Some prose line here.\n$$a = b$$\n$$c = d$$");

        assertThat(found).extracting(FormulaCandidate::getContext).containsExactly("Some prose line here.", "");
    }

    @Test
    void duplicatesAreDroppedAfterNormalization() {
        List<FormulaCandidate> found = scanner.scan("$$a = b$$\n$$a  =   b$$");

        assertThat(found).hasSize(1);
    }

    @Test
    void isValidLatexRejectsPlainTokens() {
        assertThat(LatexFormulaScanner.isValidLatex("42")).isFalse();
        assertThat(LatexFormulaScanner.isValidLatex("x_i")).isTrue();
    }

    @Test
    void documentStructureLinesAreNotFormulas() {
        List<FormulaCandidate> found = scanner.scan("\\documentclass{article}\n"
            + "\\usepackage{amsmath}\n"
            + "\\maketitle\n"
            + "\\section{Method}\n"
            + "We minimize the loss.\n"
            + "$$L = y^2$$ (1)");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("L = y^2");
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.EQUATION);
        assertThat(found.get(0).getNumber()).isEqualTo("(1)");
        assertThat(found.get(0).getContext()).contains("We minimize the loss");
    }

    @Test
    void recognizesStructureLines() {
        assertThat(LatexFormulaScanner.isStructureLine("\\usepackage[utf8]{inputenc}")).isTrue();
        assertThat(LatexFormulaScanner.isStructureLine("\\section*{Related Work} \\label{sec:rw}")).isTrue();
        assertThat(LatexFormulaScanner.isStructureLine("\\frac{a}{b} = c")).isFalse();
    }

    @Test
    void numberedLineNumbersItsLastMathFragment() {
        List<FormulaCandidate> found = scanner.scan("Let $x$ and $y = W x + b$ hold (4)");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).getLatex()).isEqualTo("y = W x + b");
        assertThat(found.get(0).getType()).isEqualTo(FormulaType.EQUATION);
        assertThat(found.get(0).getNumber()).isEqualTo("(4)");
    }

    @Test
    void earlierFragmentsOnNumberedLineStayInline() {
        List<FormulaCandidate> found = scanner.scan("Set $\\alpha_t = 0.1$ and $y = W x + b$ (4)");

        assertThat(found).extracting(FormulaCandidate::getLatex).containsExactly("\\alpha_t = 0.1", "y = W x + b");
        assertThat(found).extracting(FormulaCandidate::getType)
            .containsExactly(FormulaType.INLINE, FormulaType.EQUATION);
        assertThat(found.get(0).getNumber()).isNull();
        assertThat(found.get(1).getNumber()).isEqualTo("(4)");
    }
}
