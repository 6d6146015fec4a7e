package com.autoinsight.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

public class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();
  private final AtomicReference<String> seenUser = new AtomicReference<>();
  private final AtomicReference<String> seenCorrelationId = new AtomicReference<>();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void shouldUseHeadersWhenPresent() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/mapping/ecommerce");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "analyst");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "req-42");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, capturingChain());

    assertThat(seenUser.get()).isEqualTo("analyst");
    assertThat(seenCorrelationId.get()).isEqualTo("req-42");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("req-42");
  }

  @Test
  void shouldFallBackToSessionUser() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.getSession(true).setAttribute("username", "session-user");

    filter.doFilter(request, new MockHttpServletResponse(), capturingChain());

    assertThat(seenUser.get()).isEqualTo("session-user");
  }

  @Test
  void shouldDefaultToAnonymousAndGenerateCorrelationId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, capturingChain());

    assertThat(seenUser.get()).isEqualTo(RequestMdcFilter.DEFAULT_USERNAME);
    assertThat(seenCorrelationId.get()).isNotBlank();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER))
        .isEqualTo(seenCorrelationId.get());
  }

  @Test
  void shouldClearMdcAfterRequest() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "analyst");

    filter.doFilter(request, new MockHttpServletResponse(), capturingChain());

    assertThat(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  private MockFilterChain capturingChain() {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            seenUser.set(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY));
            seenCorrelationId.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
          }
        });
  }
}
