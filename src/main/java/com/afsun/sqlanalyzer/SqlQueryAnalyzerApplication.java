package com.afsun.sqlanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL查询分析应用主类
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.sqlanalyzer")
@ConfigurationPropertiesScan
public class SqlQueryAnalyzerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlQueryAnalyzerApplication.class, args);
    }
}
