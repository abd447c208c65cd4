package com.example.oidc_rp.filter;

import com.example.oidc_rp.dto.ErrorResponse;
import com.example.oidc_rp.exception.RateLimitExceededException;
import com.example.oidc_rp.exception.SessionCorruptedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * フィルターチェーン例外ハンドラー
 *
 * <p>Spring Securityのフィルターチェーン内で発生した例外を捕捉し、
 * GlobalExceptionHandlerと同じErrorResponse形式でエラーレスポンスを返します。</p>
 *
 * <h3>処理する例外:</h3>
 * <ul>
 *   <li>{@link RateLimitExceededException} - 429（{@link RateLimitFilter}）</li>
 *   <li>{@link SessionCorruptedException} - 500、メッセージに元例外のクラス名を含む（{@link SessionExpiryFilter}）</li>
 *   <li>その他 - 500</li>
 * </ul>
 *
 * <h3>配置位置:</h3>
 * <p>Spring Securityフィルターチェーンの最初に配置し、
 * すべてのフィルターで発生した例外をキャッチできるようにします。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterChainExceptionHandler extends OncePerRequestFilter {

    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } catch (RateLimitExceededException ex) {
            handleRateLimitExceeded(request, response, ex);
        } catch (SessionCorruptedException ex) {
            handleSessionCorrupted(request, response, ex);
        } catch (Exception ex) {
            handleGenericException(request, response, ex);
        }
    }

    private void handleRateLimitExceeded(
        HttpServletRequest request,
        HttpServletResponse response,
        RateLimitExceededException ex
    ) throws IOException {
        log.warn("レート制限超過: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
            "TOO_MANY_REQUESTS",
            ex.getMessage(),
            HttpStatus.TOO_MANY_REQUESTS.value(),
            request.getRequestURI()
        );

        sendErrorResponse(response, HttpStatus.TOO_MANY_REQUESTS, errorResponse);
    }

    /**
     * セッション破損例外の処理
     *
     * <p>ログ出力とセッションのクリーンアップは {@link com.example.oidc_rp.service.OidcSessionService} で実施済み。</p>
     */
    private void handleSessionCorrupted(
        HttpServletRequest request,
        HttpServletResponse response,
        SessionCorruptedException ex
    ) throws IOException {
        ErrorResponse errorResponse = new ErrorResponse(
            "SESSION_CORRUPTED",
            ex.getMessage(),
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI()
        );

        sendErrorResponse(response, HttpStatus.INTERNAL_SERVER_ERROR, errorResponse);
    }

    private void handleGenericException(
        HttpServletRequest request,
        HttpServletResponse response,
        Exception ex
    ) throws IOException {
        log.error("フィルターチェーン内で予期しないエラー: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
            "INTERNAL_SERVER_ERROR",
            "内部サーバーエラーが発生しました",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI()
        );

        sendErrorResponse(response, HttpStatus.INTERNAL_SERVER_ERROR, errorResponse);
    }

    private void sendErrorResponse(
        HttpServletResponse response,
        HttpStatus status,
        ErrorResponse errorResponse
    ) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        String jsonResponse = objectMapper.writeValueAsString(errorResponse);
        response.getWriter().write(jsonResponse);
        response.getWriter().flush();
    }
}
