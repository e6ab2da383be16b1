package com.example.formulamap.service.extraction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns formula IDs for one extraction run. Not shared between runs.
 *
 * <ul>
 *   <li>numbered: {@code eq<n>} with punctuation removed; repeats of a number get {@code _2}, {@code _3}</li>
 *   <li>inline: {@code inline_<k>} from the inline counter</li>
 *   <li>other display formulas: {@code eq<k>} from the display counter, or {@code eq<k>_u}
 *       when a numbered formula of the same document already owns {@code eq<k>}</li>
 * </ul>
 * IDs depend only on the full candidate sequence of the document, never on filters.
 */
class FormulaIdAssigner {

    private int inlineCounter = 0;
    private int displayCounter = 0;
    private final Map<String, Integer> numberedSeen = new HashMap<>();
    private final Set<String> numberedIds = new HashSet<>();
    private final Set<String> assigned = new HashSet<>();

    List<String> assign(List<FormulaCandidate> candidates) {
        for (FormulaCandidate candidate : candidates) {
            if (candidate.isNumbered()) {
                numberedIds.add(numberedBase(candidate.getNumber()));
            }
        }

        List<String> ids = new ArrayList<>(candidates.size());
        for (FormulaCandidate candidate : candidates) {
            String id;
            if (candidate.isNumbered()) {
                String base = numberedBase(candidate.getNumber());
                int occurrence = numberedSeen.merge(base, 1, Integer::sum);
                id = occurrence == 1 ? base : base + "_" + occurrence;
            } else if (candidate.isInline()) {
                inlineCounter++;
                id = "inline_" + inlineCounter;
            } else {
                displayCounter++;
                id = "eq" + displayCounter;
                if (numberedIds.contains(id)) {
                    id = id + "_u";
                }
            }

            if (!assigned.add(id)) {
                throw new IllegalStateException("Duplicate formula id assigned: " + id);
            }
            ids.add(id);
        }
        return ids;
    }

    static String numberedBase(String number) {
        return "eq" + number.replaceAll("[^0-9A-Za-z]", "");
    }
}
