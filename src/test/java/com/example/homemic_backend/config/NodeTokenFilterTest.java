package com.example.homemic_backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class NodeTokenFilterTest {

    @Test
    void rejectsNodeRouteWithoutToken() throws Exception {
        MockHttpServletResponse response = run(new NodeTokenFilter("s3cret"), "POST", "/api/nodes/kitchen/heartbeat", null);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("NODE_TOKEN_INVALID");
    }

    @Test
    void rejectsWrongToken() throws Exception {
        MockHttpServletResponse response = run(new NodeTokenFilter("s3cret"), "POST", "/api/batch/upload", "guess");

        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    void acceptsMatchingToken() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/nodes/kitchen/audio-level");
        request.addHeader(NodeTokenFilter.HEADER, "s3cret");

        new NodeTokenFilter("s3cret").doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void leavesDashboardRoutesAlone() throws Exception {
        MockHttpServletResponse response = run(new NodeTokenFilter("s3cret"), "GET", "/api/batch/history", null);

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void blankTokenDisablesTheCheck() throws Exception {
        MockHttpServletResponse response = run(new NodeTokenFilter(" "), "POST", "/api/batch/upload", null);

        assertThat(response.getStatus()).isEqualTo(200);
    }

    private static MockHttpServletResponse run(NodeTokenFilter filter, String method, String uri, String token) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        if (token != null) {
            request.addHeader(NodeTokenFilter.HEADER, token);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
