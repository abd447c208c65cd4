package com.example.oidc_rp.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 統一エラーレスポンス
 *
 * <p>{@link com.example.oidc_rp.exception.GlobalExceptionHandler} と
 * {@link com.example.oidc_rp.filter.FilterChainExceptionHandler} の両方で使用します。</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    /** エラーコード（例: UNAUTHORIZED, SESSION_CORRUPTED） */
    private String error;

    /** エラーメッセージ */
    private String message;

    /** HTTPステータスコード */
    private int status;

    /** リクエストパス */
    private String path;
}
