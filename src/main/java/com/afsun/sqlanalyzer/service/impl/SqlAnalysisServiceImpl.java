package com.afsun.sqlanalyzer.service.impl;

import com.afsun.sqlanalyzer.config.SqlAnalyzerProperties;
import com.afsun.sqlanalyzer.core.analyzer.AnalysisResult;
import com.afsun.sqlanalyzer.core.analyzer.CachingQueryAnalyzer;
import com.afsun.sqlanalyzer.core.ast.SqlRenderer;
import com.afsun.sqlanalyzer.core.ast.Statement;
import com.afsun.sqlanalyzer.core.cache.CacheStats;
import com.afsun.sqlanalyzer.core.exceptions.AnalysisTimeoutException;
import com.afsun.sqlanalyzer.core.exceptions.ParseFailedException;
import com.afsun.sqlanalyzer.core.parser.CancellationToken;
import com.afsun.sqlanalyzer.core.parser.NodePool;
import com.afsun.sqlanalyzer.core.parser.ParseContext;
import com.afsun.sqlanalyzer.core.parser.ParseErrorKind;
import com.afsun.sqlanalyzer.core.parser.ParseResult;
import com.afsun.sqlanalyzer.core.parser.Parser;
import com.afsun.sqlanalyzer.service.SqlAnalysisService;
import com.afsun.sqlanalyzer.vo.AnalysisReport;
import com.afsun.sqlanalyzer.vo.ParseSummary;
import com.afsun.sqlanalyzer.vo.StatementAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * SQL分析服务
 * 每个工作线程持有独立的 ParseContext（对象池不跨线程共享），分析结果缓存全局共享
 *
 * @author afsun
 */
@Service
@Slf4j
public class SqlAnalysisServiceImpl implements SqlAnalysisService {

    private final CachingQueryAnalyzer queryAnalyzer;
    private final SqlAnalyzerProperties properties;
    private final ThreadLocal<ParseContext> parseContexts;

    public SqlAnalysisServiceImpl(CachingQueryAnalyzer queryAnalyzer, SqlAnalyzerProperties properties) {
        this.queryAnalyzer = queryAnalyzer;
        this.properties = properties;
        int maxFree = properties.getPool().getMaxFreePerShape();
        this.parseContexts = ThreadLocal.withInitial(() -> new ParseContext(maxFree));
    }

    @Override
    public ParseSummary parse(String sqlText) {
        validate(sqlText);
        ParseContext context = parseContexts.get();
        ParseResult parsed = new Parser(sqlText, context, newCancellationToken()).parseAll();

        ParseSummary summary = new ParseSummary();
        summary.setSuccess(parsed.isSuccess());
        summary.setErrors(parsed.getErrors());
        summary.setMetrics(parsed.getMetrics());
        for (Statement statement : parsed.getStatements()) {
            summary.getStatements().add(SqlRenderer.render(statement));
        }
        release(context.getNodePool(), parsed);

        log.debug("SQL解析完成, 语句={}, 诊断={}", parsed.getStatements().size(), parsed.getErrors().size());
        return summary;
    }

    @Override
    public AnalysisReport analyze(String sqlText) {
        validate(sqlText);
        long startTime = System.currentTimeMillis();
        String traceId = "SA-" + startTime;

        ParseContext context = parseContexts.get();
        ParseResult parsed = new Parser(sqlText, context, newCancellationToken()).parseAll();
        if (parsed.getStatements().isEmpty()) {
            boolean timedOut = parsed.getErrors().stream()
                    .anyMatch(e -> e.getKind() == ParseErrorKind.CANCELLED);
            if (timedOut) {
                throw new AnalysisTimeoutException(properties.getParseTimeoutMs());
            }
            log.warn("SQL脚本没有可分析的语句, traceId={}, 诊断={}", traceId, parsed.getErrors().size());
            throw new ParseFailedException(parsed.getErrors(),
                    "脚本中没有可分析的语句, 诊断数={}, traceId={}", parsed.getErrors().size(), traceId);
        }

        AnalysisReport report = new AnalysisReport();
        report.setTraceId(traceId);
        report.setErrors(parsed.getErrors());
        report.setMetrics(parsed.getMetrics());
        try {
            for (Statement statement : parsed.getStatements()) {
                AnalysisResult result = queryAnalyzer.analyze(statement);
                report.getStatements().add(new StatementAnalysis(SqlRenderer.render(statement), result));
            }
        } finally {
            // 分析结果不引用语法树节点，可以安全归还
            release(context.getNodePool(), parsed);
        }
        report.setAnalyzeMillis(System.currentTimeMillis() - startTime);

        if (parsed.hasErrors()) {
            log.warn("SQL分析部分完成, traceId={}, 跳过语句诊断={}", traceId, parsed.getErrors().size());
        }
        log.info("SQL分析完成, traceId={}, 语句={}, 诊断={}, 词法单元={}, 耗时={}ms",
                traceId, report.getStatements().size(), parsed.getErrors().size(),
                parsed.getMetrics().getTokensProcessed(), report.getAnalyzeMillis());
        return report;
    }

    @Override
    public CacheStats cacheStats() {
        return queryAnalyzer.getCacheStats();
    }

    private void validate(String sqlText) {
        if (StringUtils.isBlank(sqlText)) {
            throw new IllegalArgumentException("SQL文本不能为空");
        }
        if (sqlText.length() > properties.getMaxTextLength()) {
            throw new IllegalArgumentException(String.format("SQL文本长度超过限制：%d > %d",
                    sqlText.length(), properties.getMaxTextLength()));
        }
    }

    private CancellationToken newCancellationToken() {
        long timeoutMs = properties.getParseTimeoutMs();
        return timeoutMs > 0 ? CancellationToken.withTimeout(Duration.ofMillis(timeoutMs)) : CancellationToken.NONE;
    }

    private static void release(NodePool pool, ParseResult parsed) {
        for (Statement statement : parsed.getStatements()) {
            pool.release(statement);
        }
    }
}
