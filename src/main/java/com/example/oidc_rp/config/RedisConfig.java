package com.example.oidc_rp.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.session.data.redis.config.annotation.web.http.EnableRedisHttpSession;

/**
 * Redis設定クラス
 *
 * <p>{@code @EnableRedisHttpSession} によりHTTPセッション（セッション認証レコード、
 * 保留中の認可リクエスト、ログイン後の遷移先）をRedisに保存します。
 * 複数インスタンス構成でもコールバックを受けたインスタンスが認可リクエストを取り出せます。</p>
 *
 * <p>{@code app.session.redis.enabled=false} の場合はサーブレットコンテナ標準のセッションを使用します。</p>
 */
@Configuration
@ConditionalOnProperty(name = "app.session.redis.enabled", havingValue = "true", matchIfMissing = true)
@EnableRedisHttpSession(maxInactiveIntervalInSeconds = 1800) // 30分
public class RedisConfig {
}
