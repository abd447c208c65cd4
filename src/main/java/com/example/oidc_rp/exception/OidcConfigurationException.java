package com.example.oidc_rp.exception;

/**
 * 設定エラー例外
 *
 * <p>起動時の設定検証、またはIdPの機能不足により処理を継続できない場合にスローされる。
 * リトライやフォールバックはせず、起動処理または該当リクエストを中断する。</p>
 *
 * <h3>主な発生箇所:</h3>
 * <ul>
 *   <li>{@link com.example.oidc_rp.config.ProviderConfigurationLoader} - 必須スコープ不足、削除済み設定キー</li>
 *   <li>{@link com.example.oidc_rp.config.ClientSecretsLoader} - シークレットの読み込み失敗</li>
 *   <li>{@link com.example.oidc_rp.client.OidcMetadataClient} - Discoveryドキュメントの不備</li>
 * </ul>
 *
 * @see com.example.oidc_rp.exception.GlobalExceptionHandler
 */
public class OidcConfigurationException extends RuntimeException {

    public OidcConfigurationException(String message) {
        super(message);
    }

    public OidcConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
