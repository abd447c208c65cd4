package com.example.oidc_rp.filter;

import com.example.oidc_rp.exception.RateLimitExceededException;
import com.example.oidc_rp.support.OidcTestFixtures;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.distributed.BucketProxy;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import io.github.bucket4j.distributed.proxy.RemoteBucketBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RateLimitFilterの単体テスト
 *
 * <p>Redis上のバケットはモック化し、キーの生成と制限超過時の動作を検証します。</p>
 */
@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    @Mock
    private ProxyManager<byte[]> proxyManager;

    @Mock
    private RemoteBucketBuilder<byte[]> bucketBuilder;

    @Mock
    private BucketProxy bucket;

    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RateLimitFilter(proxyManager, OidcTestFixtures.providerConfiguration().build());
        ReflectionTestUtils.setField(filter, "loginRateLimitRpm", 30);
        ReflectionTestUtils.setField(filter, "apiRateLimitRpm", 100);
        ReflectionTestUtils.setField(filter, "apiPathPrefix", "/api");
    }

    private MockHttpServletRequest request(String uri) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRemoteAddr("192.0.2.1");
        return request;
    }

    private void stubBucket(String key, boolean allowed) {
        when(proxyManager.builder()).thenReturn(bucketBuilder);
        when(bucketBuilder.build(
            aryEq(key.getBytes(StandardCharsets.UTF_8)),
            ArgumentMatchers.<Supplier<BucketConfiguration>>any()
        )).thenReturn(bucket);
        when(bucket.tryConsume(1)).thenReturn(allowed);
    }

    @Test
    void testRateLimitKey() {
        assertThat(filter.getRateLimitKey(request("/login"), "/login")).isEqualTo("rate_limit:login:192.0.2.1");
        assertThat(filter.getRateLimitKey(request("/api/data"), "/api/data")).isEqualTo("rate_limit:api:192.0.2.1");
        assertThat(filter.getRateLimitKey(request("/api"), "/api")).isEqualTo("rate_limit:api:192.0.2.1");
        assertThat(filter.getRateLimitKey(request("/apiary"), "/apiary")).isNull();
        assertThat(filter.getRateLimitKey(request("/"), "/")).isNull();
    }

    @Test
    void testLogin_WithinLimit_ShouldContinueChain() throws Exception {
        stubBucket("rate_limit:login:192.0.2.1", true);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/login"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void testApi_LimitExceeded_ShouldThrow() {
        stubBucket("rate_limit:api:192.0.2.1", false);
        MockFilterChain chain = new MockFilterChain();

        assertThatThrownBy(() -> filter.doFilter(request("/api/data"), new MockHttpServletResponse(), chain))
            .isInstanceOf(RateLimitExceededException.class);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void testUnlimitedPath_ShouldNotTouchBuckets() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("/public"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verify(proxyManager, never()).builder();
    }

    @Test
    void testExcludedPaths_ShouldNotBeFiltered() throws Exception {
        for (String path : new String[] {"/actuator/health", "/authorize", "/logout"}) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(request(path), new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).isNotNull();
        }
        verify(proxyManager, never()).builder();
    }
}
