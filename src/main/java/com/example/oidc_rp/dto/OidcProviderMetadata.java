package com.example.oidc_rp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * OIDC Discoveryエンドポイントから取得するメタデータを格納するDTO
 *
 * <p>このアプリケーションが使用するエンドポイントのみを定義する。</p>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OidcProviderMetadata {

    private String issuer;

    @JsonProperty("authorization_endpoint")
    private String authorizationEndpoint;

    @JsonProperty("token_endpoint")
    private String tokenEndpoint;

    @JsonProperty("userinfo_endpoint")
    private String userinfoEndpoint;

    /**
     * RFC 7662 トークンイントロスペクションのエンドポイントURL
     *
     * <p>IdPがイントロスペクションをサポートしない場合は null。</p>
     */
    @JsonProperty("introspection_endpoint")
    private String introspectionEndpoint;

    @JsonProperty("jwks_uri")
    private String jwksUri;
}
