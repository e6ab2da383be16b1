package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaRole;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class RoleClassification {
    FormulaRole role;
    double confidence;
}
