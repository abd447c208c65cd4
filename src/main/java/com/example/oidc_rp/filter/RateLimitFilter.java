package com.example.oidc_rp.filter;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * レート制限フィルター
 *
 * <p>ログインルートとBearerトークン保護APIへの過剰なリクエストを制限します。
 * ログイン開始とイントロスペクションはいずれもIdPへの通信を伴うため、IdPへの負荷も抑えられます。</p>
 *
 * <h3>レート制限ルール:</h3>
 * <table border="1">
 *   <tr>
 *     <th>エンドポイント</th>
 *     <th>制限（デフォルト）</th>
 *     <th>識別方法</th>
 *   </tr>
 *   <tr>
 *     <td>{prefix}/login</td>
 *     <td>30リクエスト/分</td>
 *     <td>IPアドレス</td>
 *   </tr>
 *   <tr>
 *     <td>/api/**</td>
 *     <td>100リクエスト/分</td>
 *     <td>IPアドレス</td>
 *   </tr>
 * </table>
 *
 * <h3>除外エンドポイント:</h3>
 * <ul>
 *   <li>/actuator/health - 監視システムからのヘルスチェック</li>
 *   <li>{prefix}/authorize - IdPからのコールバック</li>
 *   <li>{prefix}/logout - ログアウト</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rate-limit.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitFilter extends OncePerRequestFilter {

    static final String LOGIN_KEY_PREFIX = "rate_limit:login:";
    static final String API_KEY_PREFIX = "rate_limit:api:";

    private final ProxyManager<byte[]> proxyManager;
    private final ProviderConfiguration providerConfiguration;

    @Value("${rate-limit.login.rpm:30}")
    private int loginRateLimitRpm;

    @Value("${rate-limit.api.rpm:100}")
    private int apiRateLimitRpm;

    @Value("${rate-limit.api.path-prefix:/api}")
    private String apiPathPrefix;

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String key = getRateLimitKey(request, path);

        // レート制限対象外のパスの場合はスキップ
        if (key == null) {
            filterChain.doFilter(request, response);
            return;
        }

        BucketConfiguration config = getBucketConfiguration(key);

        // Bucketを取得（Redis上で分散管理）
        Bucket bucket = proxyManager.builder()
            .build(key.getBytes(StandardCharsets.UTF_8), () -> config);

        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
        } else {
            log.warn("レート制限超過: path={}, key={}", path, key);
            throw new RateLimitExceededException("リクエスト数が制限を超えました。しばらく待ってから再試行してください。");
        }
    }

    /**
     * レート制限キーを生成（nullの場合は制限なし）
     */
    String getRateLimitKey(HttpServletRequest request, String path) {
        // ForwardedHeaderFilterにより、request.getRemoteAddr()が正しいクライアントIPを返す
        if (path.equals(providerConfiguration.getLoginPath())) {
            return LOGIN_KEY_PREFIX + request.getRemoteAddr();
        }
        if (path.equals(apiPathPrefix) || path.startsWith(apiPathPrefix + "/")) {
            return API_KEY_PREFIX + request.getRemoteAddr();
        }
        return null;
    }

    private BucketConfiguration getBucketConfiguration(String key) {
        long limit = key.startsWith(LOGIN_KEY_PREFIX) ? loginRateLimitRpm : apiRateLimitRpm;

        return BucketConfiguration.builder()
            .addLimit(
                Bandwidth.builder()
                    .capacity(limit)
                    .refillIntervally(limit, Duration.ofMinutes(1))
                    .build()
            )
            .build();
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());

        return path.equals("/actuator/health")
            || path.equals(providerConfiguration.getAuthorizePath())
            || path.equals(providerConfiguration.getLogoutPath());
    }
}
