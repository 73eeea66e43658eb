package com.elssolution.insteonbridge.web;

import com.elssolution.insteonbridge.config.BridgeSettings;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BearerTokenFilterTest {

    private static BearerTokenFilter filter(String token) {
        BridgeSettings settings = new BridgeSettings();
        settings.setAuthToken(token);
        return new BearerTokenFilter(settings);
    }

    @Test
    void prefixIsOptionalAndCaseInsensitive() {
        assertThat(BearerTokenFilter.extractToken("Bearer abc")).isEqualTo("abc");
        assertThat(BearerTokenFilter.extractToken("bearer abc")).isEqualTo("abc");
        assertThat(BearerTokenFilter.extractToken("abc")).isEqualTo("abc");
        assertThat(BearerTokenFilter.extractToken(null)).isNull();
    }

    @Test
    void noTokenConfiguredLetsEverythingThrough() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/discovery");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        filter("").doFilter(req, resp, chain);

        verify(chain).doFilter(req, resp);
    }

    @Test
    void statusIsExemptButOnlyForGet() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletResponse resp = new MockHttpServletResponse();

        filter("t").doFilter(new MockHttpServletRequest("GET", "/status"), resp, chain);
        verify(chain).doFilter(any(), any());

        MockHttpServletResponse denied = new MockHttpServletResponse();
        filter("t").doFilter(new MockHttpServletRequest("POST", "/status"), denied, mock(FilterChain.class));
        assertThat(denied.getStatus()).isEqualTo(401);
    }

    @Test
    void wrongTokenIs401WithJsonBody() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/devices");
        req.addHeader("Authorization", "Bearer nope");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        filter("t").doFilter(req, resp, chain);

        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(resp.getContentAsString()).contains("\"success\":false");
        verify(chain, never()).doFilter(any(), any());
    }
}
