/*
 * どこで: Customer Web 層のテスト
 * 何を: MDC への積み込みと後始末を検証する
 * なぜ: プールされたスレッドに前リクエストの利用者が残らないことを保証するため
 */
package com.example.customer.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.RequestIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void preHandlePutsRequestValuesAndAfterCompletionRemovesThem() {
    final MockHttpServletRequest request = new MockHttpServletRequest("PATCH", "/v1/customers/1");
    request.addHeader("X-User-Id", "admin-1");
    request.addHeader(RequestIds.HEADER, "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("user_id")).isEqualTo("admin-1");
    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(response.getHeader(RequestIds.HEADER)).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("request_id")).isNull();
  }

  @Test
  void preHandleSkipsBlankUserId() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/customers/1");
    request.addHeader("X-User-Id", " ");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("request_id")).isNotBlank();
  }
}
