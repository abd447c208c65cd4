package com.example.oidc_rp.client;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.dto.OidcProviderMetadata;
import com.example.oidc_rp.dto.TokenIntrospection;
import com.example.oidc_rp.exception.IntrospectionUnsupportedException;
import com.example.oidc_rp.exception.OidcConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ReactiveHttpInputMessage;
import org.springframework.security.crypto.keygen.Base64StringKeyGenerator;
import org.springframework.security.crypto.keygen.StringKeyGenerator;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.endpoint.WebClientReactiveAuthorizationCodeTokenResponseClient;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.client.web.OAuth2AuthorizationRequestCustomizers;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.endpoint.DefaultMapOAuth2AccessTokenResponseConverter;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationExchange;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationResponse;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyExtractor;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebClientを使用した {@link OidcClient} の実装
 *
 * <p>トークンリクエスト/レスポンスのプロトコル処理は Spring Security の
 * {@link WebClientReactiveAuthorizationCodeTokenResponseClient} に委譲する。
 * クライアント認証方式（client_secret_post / client_secret_basic / none）は
 * トークンエンドポイントとイントロスペクションエンドポイントで共通。</p>
 */
@Slf4j
@Component
public class WebClientOidcClient implements OidcClient {

    static final String REGISTRATION_ID = "oidc";

    static final String EXPIRES_AT = "expires_at";

    private static final String INVALID_TOKEN_RESPONSE = "invalid_token_response";

    private static final ParameterizedTypeReference<Map<String, Object>> CLAIMS_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final OidcMetadataClient metadataClient;
    private final ProviderConfiguration providerConfiguration;
    private final WebClientReactiveAuthorizationCodeTokenResponseClient tokenResponseClient;
    private final StringKeyGenerator stateGenerator = new Base64StringKeyGenerator(Base64.getUrlEncoder());
    private final DefaultMapOAuth2AccessTokenResponseConverter tokenResponseConverter =
        new DefaultMapOAuth2AccessTokenResponseConverter();

    public WebClientOidcClient(
        WebClient webClient,
        OidcMetadataClient metadataClient,
        ProviderConfiguration providerConfiguration
    ) {
        this.webClient = webClient;
        this.metadataClient = metadataClient;
        this.providerConfiguration = providerConfiguration;
        this.tokenResponseClient = new WebClientReactiveAuthorizationCodeTokenResponseClient();
        this.tokenResponseClient.setWebClient(webClient);
        this.tokenResponseClient.setBodyExtractor(tokenResponseExtractor());
    }

    @Override
    public OAuth2AuthorizationRequest createAuthorizationRequest(String redirectUri) {
        OidcProviderMetadata metadata = metadataClient.getMetadata();

        OAuth2AuthorizationRequest.Builder builder = OAuth2AuthorizationRequest.authorizationCode()
            .authorizationUri(metadata.getAuthorizationEndpoint())
            .clientId(providerConfiguration.getClientId())
            .redirectUri(redirectUri)
            .scopes(providerConfiguration.getScopeSet())
            .state(stateGenerator.generateKey())
            .attributes(attributes -> attributes.put(OAuth2ParameterNames.REGISTRATION_ID, REGISTRATION_ID));

        // PKCE (S256): code_verifier は属性に、code_challenge は追加パラメーターに入る
        OAuth2AuthorizationRequestCustomizers.withPkce().accept(builder);

        return builder.build();
    }

    @Override
    public Map<String, Object> exchangeCode(OAuth2AuthorizationRequest authorizationRequest, String code) {
        ClientRegistration registration = clientRegistration(metadataClient.getMetadata(), authorizationRequest);

        OAuth2AuthorizationResponse authorizationResponse = OAuth2AuthorizationResponse.success(code)
            .redirectUri(authorizationRequest.getRedirectUri())
            .state(authorizationRequest.getState())
            .build();
        OAuth2AuthorizationCodeGrantRequest grantRequest = new OAuth2AuthorizationCodeGrantRequest(
            registration,
            new OAuth2AuthorizationExchange(authorizationRequest, authorizationResponse)
        );

        OAuth2AccessTokenResponse tokenResponse = tokenResponseClient.getTokenResponse(grantRequest).block();
        if (tokenResponse == null) {
            throw new OidcConfigurationException("Empty token response from " + registration.getProviderDetails().getTokenUri());
        }

        log.debug("Authorization code exchanged at {}", registration.getProviderDetails().getTokenUri());
        return toTokenRecord(tokenResponse);
    }

    @Override
    public Map<String, Object> fetchUserInfo(String accessToken) {
        String userinfoEndpoint = metadataClient.getMetadata().getUserinfoEndpoint();
        if (userinfoEndpoint == null) {
            throw new OidcConfigurationException("The provider does not advertise a userinfo_endpoint");
        }

        Map<String, Object> claims = webClient.get()
            .uri(userinfoEndpoint)
            .headers(headers -> headers.setBearerAuth(accessToken))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(CLAIMS_TYPE)
            .block();

        return claims == null ? Collections.emptyMap() : claims;
    }

    @Override
    public TokenIntrospection introspect(String token) {
        String introspectionEndpoint = metadataClient.getMetadata().getIntrospectionEndpoint();
        if (introspectionEndpoint == null) {
            throw new IntrospectionUnsupportedException();
        }

        String authMethod = providerConfiguration.getIntrospectionAuthMethod();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("token", token);
        if (ClientAuthenticationMethod.CLIENT_SECRET_POST.getValue().equals(authMethod)) {
            form.add(OAuth2ParameterNames.CLIENT_ID, providerConfiguration.getClientId());
            form.add(OAuth2ParameterNames.CLIENT_SECRET, providerConfiguration.getClientSecret());
        } else if (ClientAuthenticationMethod.NONE.getValue().equals(authMethod)) {
            form.add(OAuth2ParameterNames.CLIENT_ID, providerConfiguration.getClientId());
        }

        Map<String, Object> claims = webClient.post()
            .uri(introspectionEndpoint)
            .headers(headers -> {
                if (ClientAuthenticationMethod.CLIENT_SECRET_BASIC.getValue().equals(authMethod)) {
                    headers.setBasicAuth(providerConfiguration.getClientId(), providerConfiguration.getClientSecret());
                }
            })
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .accept(MediaType.APPLICATION_JSON)
            .body(BodyInserters.fromFormData(form))
            .retrieve()
            .bodyToMono(CLAIMS_TYPE)
            .block();

        return new TokenIntrospection(claims);
    }

    private ClientRegistration clientRegistration(
        OidcProviderMetadata metadata,
        OAuth2AuthorizationRequest authorizationRequest
    ) {
        return ClientRegistration.withRegistrationId(REGISTRATION_ID)
            .clientId(providerConfiguration.getClientId())
            .clientSecret(providerConfiguration.getClientSecret())
            .clientAuthenticationMethod(new ClientAuthenticationMethod(providerConfiguration.getIntrospectionAuthMethod()))
            .authorizationGrantType(AuthorizationGrantType.AUTHORIZATION_CODE)
            .redirectUri(authorizationRequest.getRedirectUri())
            .scope(providerConfiguration.getScopeSet())
            .authorizationUri(metadata.getAuthorizationEndpoint())
            .tokenUri(metadata.getTokenEndpoint())
            .userInfoUri(metadata.getUserinfoEndpoint())
            .jwkSetUri(metadata.getJwksUri())
            .issuerUri(providerConfiguration.getIssuer())
            .build();
    }

    /**
     * トークンレスポンスのボディを読み取る
     *
     * <p>変換後の {@link OAuth2AccessTokenResponse} は expires_in が無いと有効期限を1秒とみなすため、
     * IdPが返した expires_in はそのまま追加パラメーターに残す。</p>
     */
    private BodyExtractor<Mono<OAuth2AccessTokenResponse>, ReactiveHttpInputMessage> tokenResponseExtractor() {
        BodyExtractor<Mono<Map<String, Object>>, ReactiveHttpInputMessage> jsonExtractor =
            BodyExtractors.toMono(CLAIMS_TYPE);
        return (inputMessage, context) -> jsonExtractor.extract(inputMessage, context)
            .map(this::toTokenResponse)
            .onErrorMap(
                e -> !(e instanceof OAuth2AuthorizationException),
                e -> new OAuth2AuthorizationException(new OAuth2Error(
                    INVALID_TOKEN_RESPONSE,
                    "An error occurred parsing the Access Token response: " + e.getMessage(),
                    null
                ), e)
            );
    }

    private OAuth2AccessTokenResponse toTokenResponse(Map<String, Object> body) {
        Object error = body.get(OAuth2ParameterNames.ERROR);
        if (error != null) {
            throw new OAuth2AuthorizationException(new OAuth2Error(
                error.toString(),
                (String) body.get(OAuth2ParameterNames.ERROR_DESCRIPTION),
                (String) body.get(OAuth2ParameterNames.ERROR_URI)
            ));
        }

        OAuth2AccessTokenResponse converted = tokenResponseConverter.convert(body);
        Object expiresIn = body.get(OAuth2ParameterNames.EXPIRES_IN);
        if (expiresIn == null) {
            return converted;
        }
        Map<String, Object> additionalParameters = new LinkedHashMap<>(converted.getAdditionalParameters());
        additionalParameters.put(OAuth2ParameterNames.EXPIRES_IN, expiresIn);
        return OAuth2AccessTokenResponse.withResponse(converted)
            .additionalParameters(additionalParameters)
            .build();
    }

    /**
     * トークンレスポンスをセッション保存用のトークンレコードに変換する
     *
     * <p>expires_at はIdPが返していればその値を優先し、なければ expires_in から算出する。
     * どちらも無いレスポンスは有効期限を決められないため {@link OAuth2AuthorizationException} とする。</p>
     */
    static Map<String, Object> toTokenRecord(OAuth2AccessTokenResponse tokenResponse) {
        OAuth2AccessToken accessToken = tokenResponse.getAccessToken();
        Map<String, Object> token = new LinkedHashMap<>(tokenResponse.getAdditionalParameters());

        token.put(OAuth2ParameterNames.ACCESS_TOKEN, accessToken.getTokenValue());
        token.put(OAuth2ParameterNames.TOKEN_TYPE, accessToken.getTokenType().getValue());
        if (!accessToken.getScopes().isEmpty()) {
            token.put(OAuth2ParameterNames.SCOPE, String.join(" ", accessToken.getScopes()));
        }
        if (tokenResponse.getRefreshToken() != null) {
            token.put(OAuth2ParameterNames.REFRESH_TOKEN, tokenResponse.getRefreshToken().getTokenValue());
        }

        if (token.get(EXPIRES_AT) == null) {
            if (token.get(OAuth2ParameterNames.EXPIRES_IN) == null || accessToken.getExpiresAt() == null) {
                throw new OAuth2AuthorizationException(new OAuth2Error(
                    INVALID_TOKEN_RESPONSE,
                    "The token response has neither expires_in nor expires_at",
                    null
                ));
            }
            token.put(EXPIRES_AT, accessToken.getExpiresAt().getEpochSecond());
        }
        return token;
    }
}
