package com.example.oidc_rp.config;

import com.example.oidc_rp.dto.ClientSecrets;
import com.example.oidc_rp.exception.OidcConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * クライアントシークレットローダー
 *
 * <p>プロバイダー名をキーとするJSONドキュメントを読み込み、最初のエントリを返す。</p>
 *
 * <h3>指定形式:</h3>
 * <ul>
 *   <li><b>インラインJSON</b>: {@code {"web": {...}}}</li>
 *   <li><b>classpathリソース</b>: {@code classpath:client_secrets.json}</li>
 *   <li><b>ファイルパス</b>: {@code /etc/oidc/client_secrets.json} または {@code file:} 付き</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientSecretsLoader {

    private static final TypeReference<LinkedHashMap<String, ClientSecrets>> SECRETS_TYPE =
        new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    /**
     * クライアントシークレットを読み込む
     *
     * @param contentOrLocation インラインJSONまたはリソースの場所
     * @return 最初のプロバイダーエントリ
     * @throws OidcConfigurationException 読み込み・解析に失敗した場合、または必須項目が欠けている場合
     */
    public ClientSecrets load(String contentOrLocation) {
        Map<String, ClientSecrets> document = readDocument(contentOrLocation);
        if (document == null || document.isEmpty()) {
            throw new OidcConfigurationException("The client secrets document has no provider entry");
        }

        Map.Entry<String, ClientSecrets> entry = document.entrySet().iterator().next();
        ClientSecrets secrets = entry.getValue();
        if (secrets == null) {
            throw new OidcConfigurationException("The client secrets entry '" + entry.getKey() + "' is empty");
        }
        requireField(entry.getKey(), "client_id", secrets.getClientId());
        requireField(entry.getKey(), "client_secret", secrets.getClientSecret());
        requireField(entry.getKey(), "issuer", secrets.getIssuer());

        log.debug("Loaded client secrets for provider '{}'", entry.getKey());
        return secrets;
    }

    private Map<String, ClientSecrets> readDocument(String contentOrLocation) {
        String value = contentOrLocation.trim();
        try {
            // インラインJSON
            if (value.startsWith("{")) {
                return objectMapper.readValue(value, SECRETS_TYPE);
            }

            Resource resource = resolve(value);
            try (InputStream in = resource.getInputStream()) {
                return objectMapper.readValue(in, SECRETS_TYPE);
            }
        } catch (IOException e) {
            throw new OidcConfigurationException("Could not read the client secrets from " + describe(value), e);
        }
    }

    private Resource resolve(String location) {
        if (location.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX) || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        return new FileSystemResource(location);
    }

    private void requireField(String provider, String name, String value) {
        if (value == null || value.isBlank()) {
            throw new OidcConfigurationException(
                "The client secrets entry '" + provider + "' is missing the '" + name + "' field"
            );
        }
    }

    // インラインJSONはシークレットを含むためログ・例外メッセージに出さない
    private String describe(String value) {
        return value.startsWith("{") ? "inline JSON" : value;
    }
}
