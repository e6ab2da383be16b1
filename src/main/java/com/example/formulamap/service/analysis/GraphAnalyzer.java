package com.example.formulamap.service.analysis;

import com.example.formulamap.dto.DependencyAnalysisResult;
import com.example.formulamap.dto.formula.Formula;
import com.example.formulamap.dto.formula.FormulaCluster;
import com.example.formulamap.dto.formula.FormulaDependency;
import com.example.formulamap.dto.formula.FormulaRole;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class GraphAnalyzer {

    static final int MAX_CLUSTER_SIZE = 10;

    public DependencyAnalysisResult.Analysis analyze(List<Formula> formulas, List<FormulaDependency> dependencies) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> outDegree = new HashMap<>();
        for (FormulaDependency dependency : dependencies) {
            outDegree.merge(dependency.getFrom(), 1, Integer::sum);
            inDegree.merge(dependency.getTo(), 1, Integer::sum);
        }

        List<String> roots = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        for (Formula formula : formulas) {
            if (inDegree.getOrDefault(formula.getId(), 0) == 0) {
                roots.add(formula.getId());
            }
            if (outDegree.getOrDefault(formula.getId(), 0) == 0) {
                leaves.add(formula.getId());
            }
        }

        return new DependencyAnalysisResult.Analysis(formulas.size(), dependencies.size(), roots, leaves,
            clusters(formulas));
    }

    /**
     * One cluster per non-empty role, in role vocabulary order.
     */
    public List<FormulaCluster> clusters(List<Formula> formulas) {
        List<FormulaCluster> clusters = new ArrayList<>();
        for (FormulaRole role : FormulaRole.values()) {
            List<String> members = formulas.stream()
                .filter(f -> f.getRole() == role)
                .map(Formula::getId)
                .limit(MAX_CLUSTER_SIZE)
                .collect(Collectors.toList());
            if (!members.isEmpty()) {
                clusters.add(new FormulaCluster("cluster_" + role.getValue(), members,
                    role.getLabel() + " formulas", role));
            }
        }
        return clusters;
    }
}
