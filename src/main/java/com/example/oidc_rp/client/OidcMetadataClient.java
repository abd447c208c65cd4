package com.example.oidc_rp.client;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.dto.OidcProviderMetadata;
import com.example.oidc_rp.exception.OidcConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OIDCプロバイダーのメタデータを管理するクライアント
 *
 * <p>初回利用時にOIDC Discoveryエンドポイントからメタデータを取得してキャッシュする。
 * 取得に失敗した場合はキャッシュせず、呼び出し元に例外をそのまま伝播する（リトライしない）。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OidcMetadataClient {

    private final WebClient webClient;
    private final ProviderConfiguration providerConfiguration;

    private volatile OidcProviderMetadata metadata;

    /**
     * メタデータを取得する（キャッシュ済みならキャッシュを返す）
     *
     * @return IdPメタデータ
     * @throws OidcConfigurationException Discoveryドキュメントが空、または必須エンドポイントが欠けている場合
     * @throws org.springframework.web.reactive.function.client.WebClientException 通信エラーの場合
     */
    public OidcProviderMetadata getMetadata() {
        OidcProviderMetadata cached = metadata;
        if (cached != null) {
            return cached;
        }

        String discoveryUrl = providerConfiguration.getServerMetadataUrl();
        log.info("Fetching OIDC metadata from {}", discoveryUrl);

        OidcProviderMetadata fetched = webClient.get()
            .uri(discoveryUrl)
            .retrieve()
            .bodyToMono(OidcProviderMetadata.class)
            .block();

        if (fetched == null) {
            throw new OidcConfigurationException("Empty OIDC metadata from " + discoveryUrl);
        }
        if (fetched.getAuthorizationEndpoint() == null || fetched.getTokenEndpoint() == null) {
            throw new OidcConfigurationException(
                "OIDC metadata from " + discoveryUrl + " lacks authorization_endpoint or token_endpoint"
            );
        }
        if (fetched.getIntrospectionEndpoint() == null) {
            log.warn("The provider does not advertise an introspection_endpoint. Bearer token validation is unavailable.");
        }

        metadata = fetched;
        return fetched;
    }
}
