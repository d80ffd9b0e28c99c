/*
 * どこで: Provisioning 冪等性台帳の補助
 * 何を: Idempotency 判定用のリクエストハッシュを生成する
 * なぜ: 同一キーで異なるリクエストを検出するため
 */
package com.teamplatform.provisioning.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestHasher {

    private final ObjectMapper objectMapper;

    /** fields は呼び出し側で順序を固定して渡す。 */
    public String hash(String action, Map<String, ?> fields) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("action", action);
        canonical.putAll(fields);
        try {
            return sha256Hex(objectMapper.writeValueAsBytes(canonical));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize request for idempotency", ex);
        }
    }

    /** 秘密値など、ハッシュ対象に生の値を載せたくない項目の SHA-256 を返す。 */
    public String digest(String value) {
        return sha256Hex(value.getBytes(StandardCharsets.UTF_8));
    }

    private String sha256Hex(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}
