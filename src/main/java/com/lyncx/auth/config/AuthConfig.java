package com.lyncx.auth.config;

import com.lyncx.auth.filter.JwtAuthenticationFilter;
import com.lyncx.auth.handler.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security 設定
 *
 * 認證方式：JWT (Bearer Token)，無 session、無 CSRF。
 *
 * 路徑規則：
 * - /api/auth/generate-token → 公開（由前端登入流程取得 token）
 * - /api/auth/verify, /api/auth/logout, /api/health → 需要 JWT
 * - /api/user/** → 需要 JWT
 * - 其他 → 放行，交給 MVC 回 404
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class AuthConfig {

    private final JwtAuthenticationFilter jwtAuthenticationFilter;
    private final CustomAuthenticationEntryPoint authenticationEntryPoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(exception -> exception
                        .authenticationEntryPoint(authenticationEntryPoint))
                .authorizeHttpRequests(auth -> auth
                        // === 預檢請求 ===
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()

                        // === 公開端點 ===
                        .requestMatchers("/api/auth/generate-token").permitAll()

                        // === 受保護：需要 JWT ===
                        .requestMatchers("/api/auth/verify", "/api/auth/logout").authenticated()
                        .requestMatchers("/api/health").authenticated()
                        .requestMatchers("/api/user/**").authenticated()

                        // === 其他：放行，未知路徑由 GlobalExceptionHandler 回 404 ===
                        .anyRequest().permitAll()
                )
                .addFilterBefore(jwtAuthenticationFilter,
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
