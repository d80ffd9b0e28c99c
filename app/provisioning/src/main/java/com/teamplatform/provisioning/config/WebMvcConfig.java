/*
 * どこで: Provisioning Web 設定
 * 何を: RequestMdcInterceptor を API リクエストへ適用する
 * なぜ: API ログへ request_id や tenant_id を安定して埋め込むため
 */
package com.teamplatform.provisioning.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // actuator のスクレイプはログ相関の対象外
    registry.addInterceptor(new RequestMdcInterceptor()).excludePathPatterns("/actuator/**");
  }
}
