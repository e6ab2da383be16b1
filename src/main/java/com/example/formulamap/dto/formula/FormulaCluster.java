package com.example.formulamap.dto.formula;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormulaCluster {
    private String id;
    private List<String> formulas = new ArrayList<>();
    private String description;
    private FormulaRole role;
}
