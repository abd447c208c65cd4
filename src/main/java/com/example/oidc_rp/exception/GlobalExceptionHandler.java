package com.example.oidc_rp.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.lang.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import org.springframework.web.util.HtmlUtils;

import com.example.oidc_rp.dto.BearerErrorResponse;
import com.example.oidc_rp.dto.ErrorResponse;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    /**
     * IdPとの認可コードフローの失敗
     *
     * <p>ブラウザ向けのため、JSONではなくHTMLのエラーページを返す。</p>
     */
    @ExceptionHandler({ AuthorizationFailedException.class })
    public ResponseEntity<String> handleAuthorizationFailed(AuthorizationFailedException ex) {
        log.warn("認可エラー: {}", ex.getMessage());

        String detail = ex.getDescription() == null
            ? ex.getError()
            : ex.getError() + ": " + ex.getDescription();
        String body = "<!doctype html>\n"
            + "<html lang=\"en\">\n"
            + "<title>401 Unauthorized</title>\n"
            + "<h1>Unauthorized</h1>\n"
            + "<p>" + HtmlUtils.htmlEscape(detail) + "</p>\n";

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .contentType(MediaType.TEXT_HTML)
            .body(body);
    }

    /**
     * Bearerトークン検証エラー（RFC 6750）
     *
     * <p>通常運用で発生するエラーのためDEBUGレベルでのみ記録する。</p>
     */
    @ExceptionHandler({ BearerTokenException.class })
    public ResponseEntity<BearerErrorResponse> handleBearerToken(BearerTokenException ex) {
        log.debug("Bearerトークンエラー: {}", ex.getMessage());

        return ResponseEntity.status(ex.getStatus())
            .header(HttpHeaders.WWW_AUTHENTICATE, ex.toWwwAuthenticate())
            .contentType(MediaType.APPLICATION_JSON)
            .body(new BearerErrorResponse(ex.getError(), ex.getDescription()));
    }

    @ExceptionHandler({ OidcConfigurationException.class })
    public ResponseEntity<Object> handleConfiguration(OidcConfigurationException ex, WebRequest request) {
        log.error("設定エラー: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
            "CONFIGURATION_ERROR",
            ex.getMessage(),
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getDescription(false).replace("uri=", "")
        );

        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            HttpStatus.INTERNAL_SERVER_ERROR,
            request
        );
    }

    @ExceptionHandler({ RateLimitExceededException.class })
    public ResponseEntity<Object> handleRateLimitExceeded(RateLimitExceededException ex, WebRequest request) {
        log.warn("レート制限超過: {}", ex.getMessage());

        String path = request.getDescription(false).replace("uri=", "");
        ErrorResponse errorResponse = new ErrorResponse(
            "TOO_MANY_REQUESTS",
            ex.getMessage(),
            HttpStatus.TOO_MANY_REQUESTS.value(),
            path
        );

        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            HttpStatus.TOO_MANY_REQUESTS,
            request
        );
    }

    @ExceptionHandler({ UnauthorizedException.class })
    public ResponseEntity<Object> handleUnauthorized(UnauthorizedException ex, WebRequest request) {
        log.warn("認証エラー: {}", ex.getMessage());

        String path = request.getDescription(false).replace("uri=", "");
        ErrorResponse errorResponse = new ErrorResponse(
            "UNAUTHORIZED",
            ex.getMessage(),
            HttpStatus.UNAUTHORIZED.value(),
            path
        );
        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            HttpStatus.UNAUTHORIZED,
            request
        );
    }

    @ExceptionHandler({ WebClientResponseException.class })
    public ResponseEntity<Object> handleWebClientResponse(WebClientResponseException ex, WebRequest request) {
        log.warn("認証サーバーとの通信エラー: {} - {}", ex.getStatusCode(), ex.getMessage());

        String path = request.getDescription(false).replace("uri=", "");
        String errorCode;
        String message;
        HttpStatus status;

        // 認証サーバーからのエラーレスポンスを分析
        if (ex.getStatusCode().is4xxClientError()) {
            errorCode = "IDP_PROVIDER_CLIENT_ERROR";
            message = "認証サーバーがリクエストを拒否しました";
            status = HttpStatus.BAD_GATEWAY;
        } else if (ex.getStatusCode().is5xxServerError()) {
            errorCode = "IDP_PROVIDER_SERVER_ERROR";
            message = "認証サーバーで障害が発生しています。しばらく時間をおいて再試行してください";
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            errorCode = "IDP_PROVIDER_COMMUNICATION_ERROR";
            message = "認証サーバーとの通信でエラーが発生しました";
            status = HttpStatus.BAD_GATEWAY;
        }

        ErrorResponse errorResponse = new ErrorResponse(
            errorCode,
            message,
            status.value(),
            path
        );

        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            status,
            request
        );
    }

    @ExceptionHandler({ WebClientException.class })
    public ResponseEntity<Object> handleWebClient(WebClientException ex, WebRequest request) {
        log.error("認証サーバーへの接続エラー: {}", ex.getMessage(), ex);

        String path = request.getDescription(false).replace("uri=", "");
        ErrorResponse errorResponse = new ErrorResponse(
            "IDP_PROVIDER_CONNECTION_ERROR",
            "認証サーバーに接続できませんでした。ネットワーク接続を確認してください",
            HttpStatus.SERVICE_UNAVAILABLE.value(),
            path
        );

        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            HttpStatus.SERVICE_UNAVAILABLE,
            request
        );
    }

    @ExceptionHandler({ Exception.class })
    public ResponseEntity<Object> handleGeneral(Exception ex, WebRequest request) {
        log.error("予期しないエラー: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
            "INTERNAL_SERVER_ERROR",
            "内部サーバーエラーが発生しました",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getDescription(false).replace("uri=", "")
        );

        return this.handleExceptionInternal(
            ex,
            errorResponse,
            new HttpHeaders(),
            HttpStatus.INTERNAL_SERVER_ERROR,
            request
        );
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
        @NonNull Exception ex,
        @Nullable Object body,
        @NonNull HttpHeaders headers,
        @NonNull HttpStatusCode statusCode,
        @NonNull WebRequest request
    ) {
        // bodyがErrorResponseの場合はログ重複を避けるため、ここではログ出力しない
        if (!(body instanceof ErrorResponse)) {
            log.error("内部例外: {} - {}", statusCode, ex.getMessage(), ex);
        }

        // bodyがnullまたはErrorResponse以外の場合、統一されたErrorResponseを作成
        if (!(body instanceof ErrorResponse)) {
            String errorCode = "HTTP_" + statusCode.value();
            String message = getDefaultMessageForStatus(statusCode);
            String path = request.getDescription(false).replace("uri=", "");

            body = new ErrorResponse(errorCode, message, statusCode.value(), path);
        }

        return ResponseEntity.status(statusCode).headers(headers).body(body);
    }

    private String getDefaultMessageForStatus(HttpStatusCode status) {
        return switch (status.value()) {
        case 400 -> "不正なリクエストです";
        case 401 -> "認証が必要です";
        case 403 -> "アクセスが拒否されました";
        case 404 -> "リソースが見つかりません";
        case 405 -> "許可されていないメソッドです";
        case 429 -> "リクエスト数が制限を超えました";
        case 500 -> "内部サーバーエラーが発生しました";
        default -> "エラーが発生しました";
        };
    }
}
