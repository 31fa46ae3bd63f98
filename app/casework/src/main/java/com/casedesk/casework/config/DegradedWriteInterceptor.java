/*
 * どこで: Casework Web 設定
 * 何を: 依存先の遮断中 (cooldown 中の OPEN) は変更系リクエストを 503 で拒否する
 * なぜ: 依存先が落ちている間に中途半端な書き込みを受け付けず、参照系だけを提供し続けるため
 */
package com.casedesk.casework.config;

import com.casedesk.casework.api.DependencyUnavailableException;
import com.casedesk.casework.service.CircuitBreakerService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class DegradedWriteInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(DegradedWriteInterceptor.class);

  private static final Set<String> READ_ONLY_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

  private final CircuitBreakerService circuitBreakerService;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (READ_ONLY_METHODS.contains(request.getMethod())) {
      return true;
    }
    final List<String> blocking = circuitBreakerService.blockingDependencies();
    if (blocking.isEmpty()) {
      return true;
    }
    logger.warn(
        "write rejected in degraded mode method={} path={} dependencies={}",
        request.getMethod(),
        request.getRequestURI(),
        blocking);
    // ApiExceptionHandler が 503 DEPENDENCY_UNAVAILABLE に変換する
    throw new DependencyUnavailableException(
        String.join(",", blocking),
        "writes are temporarily blocked while a dependency is unavailable");
  }
}
