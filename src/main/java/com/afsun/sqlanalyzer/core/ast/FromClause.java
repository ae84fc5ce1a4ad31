package com.afsun.sqlanalyzer.core.ast;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class FromClause implements Node {
    private final List<TableReference> tables = new ArrayList<>();
}
