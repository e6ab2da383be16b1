package com.example.formulamap.dto.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Formula {
    private String id;
    private String latex;
    private FormulaType type;
    @Builder.Default
    private FormulaRole role = FormulaRole.UNKNOWN;
    private String number;      // as written, e.g. "(2.3)"
    private String context;
    private String section;
    private int pageNumber;
    @Builder.Default
    private List<Variable> variables = new ArrayList<>();
    private double confidence;

    public String getDisplayName() {
        return number != null ? number : id;
    }
}
