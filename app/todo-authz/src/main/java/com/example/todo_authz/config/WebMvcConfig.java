/*
 * どこで: todo-authz Web 設定
 * 何を: RequestMdcInterceptor を API とヘルスチェックへ適用する
 * なぜ: 認可判断や整合性警告のログへ request_id/user_id を安定して埋め込むため
 */
package com.example.todo_authz.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new RequestMdcInterceptor()).addPathPatterns("/api/**", "/health");
  }
}
