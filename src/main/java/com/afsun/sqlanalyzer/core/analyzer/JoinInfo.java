package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.JoinType;
import lombok.Data;

@Data
public class JoinInfo {
    private final JoinType type;
    /**
     * 尽力推断的左表，无法推断时为 null
     */
    private final String leftTable;
    private final String rightTable;
    private final String condition;
}
