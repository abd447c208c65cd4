package com.example.oidc_rp.exception;

/**
 * IdPがトークンイントロスペクションをサポートしていない場合の例外
 *
 * <p>Discoveryドキュメントに {@code introspection_endpoint} が存在しない場合、
 * Bearerトークン保護そのものが成立しないため、401ではなく設定エラーとして扱う。</p>
 */
public class IntrospectionUnsupportedException extends OidcConfigurationException {

    public IntrospectionUnsupportedException() {
        super("Can't validate the token because the server does not support introspection.");
    }
}
