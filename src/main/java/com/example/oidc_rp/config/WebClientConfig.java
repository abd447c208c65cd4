package com.example.oidc_rp.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * WebClient設定クラス
 *
 * <p>IdPとの通信（Discovery, トークン交換, UserInfo, イントロスペクション）で共有される
 * WebClientインスタンスを提供します。</p>
 *
 * <h3>使用場所:</h3>
 * <ul>
 *   <li>OidcMetadataClient: Discoveryドキュメントの取得</li>
 *   <li>WebClientOidcClient: トークンエンドポイント、UserInfo、イントロスペクション</li>
 * </ul>
 */
@Configuration
public class WebClientConfig {

    /**
     * 共有WebClient Beanの定義
     *
     * <p>接続・レスポンス・読み込み・書き込みのタイムアウトはすべて {@code oidc.http-timeout} に従います。
     * タイムアウト時はリトライせず、呼び出し元にエラーを返します。</p>
     *
     * @param providerConfiguration IdP接続設定
     * @return 設定済みWebClientインスタンス
     */
    @Bean
    public WebClient webClient(ProviderConfiguration providerConfiguration) {
        long timeoutMillis = providerConfiguration.getHttpTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
            // 接続タイムアウト設定（ミリ秒）
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
            .responseTimeout(providerConfiguration.getHttpTimeout())
            .doOnConnected(
                conn -> conn
                    .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                    .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            );

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
