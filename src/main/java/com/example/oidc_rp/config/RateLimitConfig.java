package com.example.oidc_rp.config;

import io.github.bucket4j.distributed.ExpirationAfterWriteStrategy;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import io.github.bucket4j.redis.lettuce.cas.LettuceBasedProxyManager;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * レート制限設定クラス
 *
 * <p>Bucket4j + Redisを使用した分散レート制限を構成します。
 * セッション保存と同じRedisインスタンスを使用します。</p>
 *
 * <h3>Redisキー構造:</h3>
 * <pre>
 * rate_limit:login:{IPアドレス}   - ログインルートのレート制限
 * rate_limit:api:{IPアドレス}     - Bearerトークン保護APIのレート制限
 * </pre>
 */
@Configuration
@ConditionalOnProperty(name = "rate-limit.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitConfig {

    @Value("${spring.data.redis.host}")
    private String redisHost;

    @Value("${spring.data.redis.port}")
    private int redisPort;

    /**
     * Bucket4j用のRedisクライアント（アプリケーション終了時にクローズ）
     */
    @Bean(destroyMethod = "close")
    public RedisClient redisClient() {
        RedisURI redisUri = RedisURI.builder()
            .withHost(redisHost)
            .withPort(redisPort)
            .build();

        return RedisClient.create(redisUri);
    }

    /**
     * Redis連携のProxyManager
     *
     * <p>CAS (Compare-And-Swap) 方式で複数インスタンス間の競合を解決します。
     * バケットは満杯まで回復する時間が経過するとRedisから削除されます（上限1時間）。</p>
     */
    @Bean
    public ProxyManager<byte[]> proxyManager(RedisClient redisClient) {
        return LettuceBasedProxyManager.builderFor(redisClient)
            .withExpirationStrategy(
                ExpirationAfterWriteStrategy.basedOnTimeForRefillingBucketUpToMax(
                    Duration.ofHours(1)
                )
            )
            .build();
    }
}
