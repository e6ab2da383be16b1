package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.VariableAnalysisResult;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaRole;
import com.example.formulamap.dto.formula.VariableUsage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.formulamap.service.analysis.AnalysisFixtures.formula;
import static org.assertj.core.api.Assertions.assertThat;

class VariableUsageTrackerTest {

    private final VariableUsageTracker tracker = new VariableUsageTracker();

    private final List<Formula> formulas = List.of(
        formula("eq1", FormulaRole.DEFINITION, "x"),
        formula("eq2", FormulaRole.UNKNOWN, "y", "f", "x"),
        formula("eq3", FormulaRole.OBJECTIVE, "L", "y"));

    @Test
    void tracksDefinitionsAndUsesInFirstAppearanceOrder() {
        List<VariableUsage> usages = tracker.track(formulas);

        assertThat(usages).extracting(VariableUsage::getSymbol).containsExactly("x", "y", "f", "L");
        VariableUsage x = usages.get(0);
        assertThat(x.getDefinedIn()).containsExactly("eq1");
        assertThat(x.getUsedIn()).containsExactly("eq1", "eq2");
        assertThat(x.getFirstAppearance()).isEqualTo("Method");
        assertThat(usages.get(1).isDefined()).isFalse();
    }

    @Test
    void statsCountDefinedAndMostUsed() {
        VariableAnalysisResult.Stats stats = tracker.stats(tracker.track(formulas));

        assertThat(stats.getTotalVariables()).isEqualTo(4);
        assertThat(stats.getDefinedVariables()).isEqualTo(1);
        assertThat(stats.getUndefinedVariables()).isEqualTo(3);
        assertThat(stats.getMostUsedVariables()).containsExactly("x", "y", "f", "L");
    }

    @Test
    void filterSymbolsRestrictsOutput() {
        List<VariableUsage> filtered = tracker.filterSymbols(tracker.track(formulas), List.of("y", "missing"));

        assertThat(filtered).extracting(VariableUsage::getSymbol).containsExactly("y");
        assertThat(tracker.stats(filtered).getTotalVariables()).isEqualTo(1);
        assertThat(tracker.filterSymbols(tracker.track(formulas), null)).hasSize(4);
    }

    @Test
    void repeatedSymbolInOneFormulaCountsOnce() {
        List<VariableUsage> usages = tracker.track(List.of(formula("eq1", FormulaRole.UNKNOWN, "x", "x")));

        assertThat(usages.get(0).getUsedIn()).containsExactly("eq1");
    }
}
