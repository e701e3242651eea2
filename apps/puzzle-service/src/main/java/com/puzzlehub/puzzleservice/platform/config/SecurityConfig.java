package com.puzzlehub.puzzleservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 最小化的安全配置（Resource Server）
 * -------------------------------------------------------
 * 本服务不签发 token，只校验外部身份服务签发的 JWT。
 *
 * 关键点：
 *  - 只开启 JWT 资源服务器能力（oauth2ResourceServer().jwt()）；
 *  - 放行 /actuator/** 与 /ws/**（STOMP 握手，token 在 CONNECT 帧中由拦截器校验）；
 *  - 其余路径要求已认证。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**", "/ws/**").permitAll()
                        .anyRequest().authenticated()
                )
                // Spring 依据 application.yml 的 issuer-uri 自动解码与验签
                .oauth2ResourceServer(oauth -> oauth.jwt());
        return http.build();
    }
}
