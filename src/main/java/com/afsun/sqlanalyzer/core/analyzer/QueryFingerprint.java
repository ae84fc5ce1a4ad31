package com.afsun.sqlanalyzer.core.analyzer;

import com.afsun.sqlanalyzer.core.ast.SqlRenderer;
import com.afsun.sqlanalyzer.core.ast.Statement;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 查询指纹：语法树规范化渲染文本的 SHA-256
 * 空白、大小写关键字、注释不同但结构相同的查询得到相同指纹
 *
 * @author afsun
 */
public final class QueryFingerprint {

    private QueryFingerprint() {
    }

    public static String of(Statement statement) {
        return sha256(SqlRenderer.render(statement));
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }
}
