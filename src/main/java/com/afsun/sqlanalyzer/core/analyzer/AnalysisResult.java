package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.StatementType;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单条语句的分析结果，不可变，可在线程间直接共享
 *
 * @author afsun
 */
@Data
public class AnalysisResult {
    private final StatementType queryType;
    private final List<TableInfo> tables;
    private final List<ColumnInfo> columns;
    private final List<JoinInfo> joins;
    private final int complexityScore;
    private final List<Suggestion> suggestions;

    public AnalysisResult(StatementType queryType, List<TableInfo> tables, List<ColumnInfo> columns,
                          List<JoinInfo> joins, int complexityScore, List<Suggestion> suggestions) {
        this.queryType = queryType;
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.joins = Collections.unmodifiableList(new ArrayList<>(joins));
        this.complexityScore = complexityScore;
        this.suggestions = Collections.unmodifiableList(new ArrayList<>(suggestions));
    }
}
