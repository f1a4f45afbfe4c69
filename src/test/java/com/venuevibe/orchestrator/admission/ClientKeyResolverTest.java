package com.venuevibe.orchestrator.admission;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ClientKeyResolverTest {

    @Test
    void forwardedForWins_firstEntryOnly() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.1");

        assertThat(ClientKeyResolver.resolve(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void realIpThenSocketAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("127.0.0.9");
        assertThat(ClientKeyResolver.resolve(request)).isEqualTo("127.0.0.9");

        request.addHeader("X-Real-IP", "198.51.100.1");
        assertThat(ClientKeyResolver.resolve(request)).isEqualTo("198.51.100.1");
    }
}
