package com.purchasingpower.calcforge.model.graph;

import java.util.List;

/**
 * Advisory tag describing what a cluster mostly does. Used for naming only.
 */
public enum SemanticPurpose {
    LOOKUP("lookup", List.of("VLOOKUP", "XLOOKUP", "INDEX", "MATCH")),
    AGGREGATION("aggregation", List.of("SUM", "SUMIF", "SUMIFS", "AVERAGE", "COUNT", "COUNTIF")),
    CONDITIONAL_LOGIC("conditional_logic", List.of("IF", "AND", "OR", "NOT", "IFERROR", "IFS", "SWITCH")),
    DATE_CALCULATION("date_calculation", List.of("DATE", "TODAY", "NOW", "YEAR", "MONTH", "DAY", "DATEDIF", "EOMONTH")),
    FINANCIAL_FORMULA("financial_formula", List.of("NPV", "IRR", "PMT", "FV", "PV", "RATE")),
    PERCENTAGE("percentage", List.of("%")),
    ROUNDING("rounding", List.of("ROUND", "ROUNDUP", "ROUNDDOWN")),
    TEXT("text", List.of("CONCAT", "CONCATENATE", "LEFT", "RIGHT", "MID", "TEXT"));

    private final String key;
    private final List<String> keywords;

    SemanticPurpose(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String getKey() {
        return key;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * "conditional_logic" becomes "Conditional Logic".
     */
    public String getTitle() {
        StringBuilder title = new StringBuilder();
        for (String word : key.split("_")) {
            if (!title.isEmpty()) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}
