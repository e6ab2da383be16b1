package com.example.formulamap.service.ai;

import com.example.formulamap.dto.formula.Formula;

import java.util.List;
import java.util.Optional;

/**
 * Writes a short paragraph describing the logical flow of a paper's formulas.
 */
public interface RoleFlowDescriptionService {

    Optional<String> describeLogicalFlow(List<Formula> formulas);
}
