package com.example.formulamap.dto.ai;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of a relationship-inference call: proposals on success, a message on failure.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RelationshipInferenceResult {
    private final boolean success;
    private final List<RelationshipProposal> proposals;
    private final String error;

    public static RelationshipInferenceResult success(List<RelationshipProposal> proposals) {
        return new RelationshipInferenceResult(true, proposals != null ? List.copyOf(proposals) : List.of(), null);
    }

    public static RelationshipInferenceResult failure(String error) {
        return new RelationshipInferenceResult(false, List.of(), error);
    }

    public static RelationshipInferenceResult skipped() {
        return success(List.of());
    }
}
