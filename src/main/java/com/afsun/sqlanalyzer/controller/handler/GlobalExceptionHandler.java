package com.afsun.sqlanalyzer.controller.handler;

import com.afsun.sqlanalyzer.core.exceptions.AnalysisTimeoutException;
import com.afsun.sqlanalyzer.core.exceptions.ParseFailedException;
import com.afsun.sqlanalyzer.core.exceptions.SqlAnalyzerException;
import com.afsun.sqlanalyzer.core.parser.ParseError;
import com.afsun.sqlanalyzer.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.List;

/**
 * 全局异常处理器
 * 将解析、分析异常转换为统一的 Response 结构与对应的 HTTP 状态码
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 没有可分析的语句，诊断信息放在 data 中原样返回
     */
    @ExceptionHandler(ParseFailedException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Response<List<ParseError>> handleParseFailedException(ParseFailedException e) {
        log.warn("SQL解析失败: {}", e.getMessage());
        return Response.fail(422, e.getFormattedMessage(), e.getErrors());
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    @ResponseStatus(HttpStatus.REQUEST_TIMEOUT)
    public Response<Void> handleAnalysisTimeoutException(AnalysisTimeoutException e) {
        log.warn("SQL解析超时: {}", e.getMessage());
        return Response.fail(408, e.getFormattedMessage());
    }

    /**
     * 其他分析异常
     */
    @ExceptionHandler(SqlAnalyzerException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleSqlAnalyzerException(SqlAnalyzerException e) {
        log.error("SQL分析内部错误, code={}", e.getErrorCode(), e);
        return Response.fail(500, e.getFormattedMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Response<Void> handleMaxUploadSizeExceededException(MaxUploadSizeExceededException e) {
        log.warn("上传的SQL文件过大: {}", e.getMessage());
        return Response.fail(413, "SQL文件超过上传上限，请拆分脚本或改用 /analyze 文本接口");
    }

    /**
     * 空文本、超长文本等调用方输入问题
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("请求参数不合法: {}", e.getMessage());
        return Response.fail(400, "请求参数不合法: " + e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("未预期的系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage());
    }
}
