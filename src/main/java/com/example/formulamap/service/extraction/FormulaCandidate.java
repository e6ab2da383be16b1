package com.example.formulamap.service.extraction;

import com.example.formulamap.dto.formula.FormulaType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A formula found in section text before it receives an ID, role and variables.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormulaCandidate {
    private String latex;
    private FormulaType type;
    private String number;   // "(2)" or "(2.3)"; null when unnumbered
    private String context;
    private int position;    // char offset inside the section content

    public boolean isNumbered() {
        return number != null;
    }

    public boolean isInline() {
        return type == FormulaType.INLINE;
    }
}
