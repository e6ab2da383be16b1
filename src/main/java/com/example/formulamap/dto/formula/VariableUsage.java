package com.example.formulamap.dto.formula;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VariableUsage {
    private String symbol;
    private String latex;
    private String meaning;
    private List<String> definedIn = new ArrayList<>();
    private List<String> usedIn = new ArrayList<>();
    private String firstAppearance;

    public boolean isDefined() {
        return !definedIn.isEmpty();
    }
}
