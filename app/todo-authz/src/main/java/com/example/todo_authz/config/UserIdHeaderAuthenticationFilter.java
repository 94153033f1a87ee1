package com.example.todo_authz.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 上流で解決済みの操作ユーザー ID をヘッダから読み取り、認証済みとして扱う。
 *
 * <p>ヘッダ欠落時は何もせず、後段の認可で 401 になる。管理者判定はここでは行わない。
 */
public class UserIdHeaderAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(UserIdHeaderAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";

  private final AuthzProperties properties;

  public UserIdHeaderAuthenticationFilter(AuthzProperties properties) {
    this.properties = properties;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String userId = resolveUserId(request);
    if (userId != null) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              userId, "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "acting user header {} missing on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private String resolveUserId(HttpServletRequest request) {
    final String raw = request.getHeader(properties.userIdHeaderName());
    if (raw == null) {
      return null;
    }
    final String trimmed = raw.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
