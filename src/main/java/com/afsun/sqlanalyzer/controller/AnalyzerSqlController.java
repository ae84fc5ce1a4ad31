package com.afsun.sqlanalyzer.controller;

import com.afsun.sqlanalyzer.core.cache.CacheStats;
import com.afsun.sqlanalyzer.service.SqlAnalysisService;
import com.afsun.sqlanalyzer.vo.AnalysisReport;
import com.afsun.sqlanalyzer.vo.ParseSummary;
import com.afsun.sqlanalyzer.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.Resource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * SQL查询分析API控制器
 * 业务异常统一由 GlobalExceptionHandler 转换为响应
 *
 * @author afsun
 */
@RestController
@RequestMapping("/sql/analyzer")
@Slf4j
public class AnalyzerSqlController {

    @Resource
    private SqlAnalysisService sqlAnalysisService;

    /**
     * 仅解析SQL文本，返回规范化语句与诊断
     *
     * @param sqlText SQL脚本文本
     * @return 解析摘要
     */
    @PostMapping("/parse")
    public Response<ParseSummary> parseText(@RequestBody String sqlText) {
        log.info("开始解析SQL文本，长度: {} 字符", sqlText.length());
        return Response.success(sqlAnalysisService.parse(sqlText));
    }

    /**
     * 解析并分析SQL文本
     *
     * @param sqlText SQL脚本文本
     * @return 分析报告，包含表、列、JOIN、复杂度与优化建议
     */
    @PostMapping("/analyze")
    public Response<AnalysisReport> analyzeText(@RequestBody String sqlText) {
        log.info("开始分析SQL文本，长度: {} 字符", sqlText.length());
        AnalysisReport report = sqlAnalysisService.analyze(sqlText);
        log.info("SQL文本分析成功, traceId: {}, 耗时: {}ms", report.getTraceId(), report.getAnalyzeMillis());
        return Response.success(report);
    }

    /**
     * 通过上传文件分析SQL
     *
     * @param file SQL脚本文件（UTF-8编码）
     * @return 分析报告
     */
    @PostMapping("/upload")
    public Response<AnalysisReport> analyzeFile(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return Response.fail(400, "文件不能为空");
        }
        String filename = file.getOriginalFilename();
        log.info("开始分析SQL文件: {}, 大小: {} bytes", filename, file.getSize());

        String content;
        try {
            content = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("SQL文件读取失败: {}", filename, e);
            return Response.fail(500, "文件读取失败: " + e.getMessage());
        }
        AnalysisReport report = sqlAnalysisService.analyze(content);
        log.info("SQL文件分析成功: {}, traceId: {}, 耗时: {}ms", filename, report.getTraceId(), report.getAnalyzeMillis());
        return Response.success(report);
    }

    /**
     * 分析结果缓存统计
     */
    @GetMapping("/cache/stats")
    public Response<CacheStats> cacheStats() {
        return Response.success(sqlAnalysisService.cacheStats());
    }
}
