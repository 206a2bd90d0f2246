package cn.bitsleep.recipebook.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

@Configuration
@EnableMethodSecurity
public class SecurityConfig {

    private final TokenService tokenService;
    private final AppUserDetailsService userDetailsService;
    private final ObjectMapper objectMapper;

    public SecurityConfig(TokenService tokenService, AppUserDetailsService userDetailsService, ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.userDetailsService = userDetailsService;
        this.objectMapper = objectMapper;
    }

    @Bean
    public PasswordEncoder passwordEncoder() { return new BCryptPasswordEncoder(); }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
    http
        .cors(c -> {})
        .csrf(csrf -> csrf.disable())
        .logout(lo -> lo.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(reg -> reg
            .requestMatchers("/login", "/me").permitAll()
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            // recipe handlers answer anonymous callers themselves (redirect or 403)
            .requestMatchers("/recipe", "/recipe/**").permitAll()
            .requestMatchers(HttpMethod.GET, "/category", "/tag").permitAll()
            .anyRequest().authenticated()
        )
        .exceptionHandling(eh -> eh.authenticationEntryPoint((request, response, ex) -> {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), Map.of(
                    "timestamp", Instant.now().toString(),
                    "status", HttpServletResponse.SC_UNAUTHORIZED,
                    "error", "UNAUTHORIZED",
                    "message", ex.getMessage()));
        }))
        .addFilterBefore(new JwtFilter(tokenService, userDetailsService), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    static class JwtFilter extends OncePerRequestFilter {
        private final TokenService tokenService;
        private final AppUserDetailsService userDetailsService;
        JwtFilter(TokenService tokenService, AppUserDetailsService userDetailsService) {
            this.tokenService = tokenService;
            this.userDetailsService = userDetailsService;
        }
        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
            String auth = request.getHeader("Authorization");
            if (auth != null && auth.startsWith("Bearer ")) {
                String token = auth.substring(7);
                Long userId = tokenService.validate(token);
                if (userId != null) {
                    userDetailsService.loadById(userId).ifPresent(ud -> {
                        var authToken = new UsernamePasswordAuthenticationToken(ud, token, ud.getAuthorities());
                        SecurityContextHolder.getContext().setAuthentication(authToken);
                    });
                }
            }
            filterChain.doFilter(request, response);
        }
    }
}
