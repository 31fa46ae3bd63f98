/*
 * どこで: Casework Web 設定
 * 何を: RequestMdcInterceptor と DegradedWriteInterceptor をリクエストへ適用する
 * なぜ: API ログへ相関 ID とテナント/実行者を安定して埋め込み、遮断中の書き込みを入口で止めるため
 */
package com.casedesk.casework.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  // 遮断の解除は遮断中にこそ必要になるため、管理 API は対象外にする
  static final String CIRCUIT_BREAKER_ADMIN_PATHS = "/v1/admin/circuit-breakers/**";

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final DegradedWriteInterceptor degradedWriteInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
    registry
        .addInterceptor(degradedWriteInterceptor)
        .excludePathPatterns(CIRCUIT_BREAKER_ADMIN_PATHS);
  }
}
