package com.example.formulamap.service.ai;

import com.example.formulamap.dto.ai.RelationshipInferenceResult;
import com.example.formulamap.dto.formula.Formula;

import java.util.List;

/**
 * Proposes relationships between formulas beyond shared variables.
 */
public interface RelationshipInferenceService {

    /**
     * Never throws for provider errors; those come back as a failure result.
     */
    RelationshipInferenceResult inferRelationships(List<Formula> formulas);
}
