package com.afsun.sqlanalyzer.vo;

import com.afsun.sqlanalyzer.core.parser.ParseError;
import com.afsun.sqlanalyzer.core.parser.ParseMetrics;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 仅解析（不分析）的结果摘要
 *
 * @author afsun
 */
@Data
public class ParseSummary {

    private boolean success;

    /**
     * 解析成功的语句，规范化渲染后的文本
     */
    private List<String> statements = new ArrayList<>();

    private List<ParseError> errors = new ArrayList<>();

    private ParseMetrics metrics;
}
