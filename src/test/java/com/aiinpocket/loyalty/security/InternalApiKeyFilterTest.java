package com.aiinpocket.loyalty.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InternalApiKeyFilter 內部金鑰驗證")
class InternalApiKeyFilterTest {

    private final InternalApiKeyFilter filter =
            new InternalApiKeyFilter("secret-key", new SecurityErrorWriter(JsonMapper.builder().build()));

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("正確的金鑰建立內部服務認證並繼續過濾器鏈")
    void validKeyAuthenticates() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/gamification/points/1");
        request.addHeader(InternalApiKeyFilter.API_KEY_HEADER, "secret-key");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly(InternalApiKeyFilter.INTERNAL_AUTHORITY);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("錯誤的金鑰直接回應 401 JSON，不繼續過濾器鏈")
    void wrongKeyStopsChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/gamification/points/1");
        request.addHeader(InternalApiKeyFilter.API_KEY_HEADER, "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"error\":\"unauthenticated\"");
        assertThat(chain.getRequest()).isNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("未帶金鑰時原樣交給後續的 Bearer Token 驗證")
    void noKeyPassesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/gamification/points/1");
        request.addHeader("X-User-Id", "1");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("未設定內部金鑰時任何金鑰都無效")
    void blankConfiguredKeyRejectsAll() throws Exception {
        InternalApiKeyFilter unconfigured =
                new InternalApiKeyFilter("", new SecurityErrorWriter(JsonMapper.builder().build()));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/gamification/points/1");
        request.addHeader(InternalApiKeyFilter.API_KEY_HEADER, "anything");
        MockHttpServletResponse response = new MockHttpServletResponse();

        unconfigured.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
    }
}
