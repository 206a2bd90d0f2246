package cn.bitsleep.recipebook.auth;

import cn.bitsleep.recipebook.domain.Role;
import cn.bitsleep.recipebook.domain.User;
import cn.bitsleep.recipebook.web.Responses;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class AuthController {
    private final TokenService tokenService;
    private final AppUserDetailsService userDetailsService;
    private final PasswordEncoder passwordEncoder;

    // app_login
    @GetMapping("/login")
    public ResponseEntity<Map<String, Object>> loginForm() {
        return Responses.render("security/login", Map.of("form", new LoginReq()));
    }

    @PostMapping("/login")
    public Map<String, Object> login(@Valid @RequestBody LoginReq req) {
        AppUserDetails principal;
        try {
            principal = userDetailsService.loadUserByUsername(req.getEmail().trim());
        } catch (UsernameNotFoundException e) {
            throw new BadCredentialsException("Invalid credentials", e);
        }
        if (!passwordEncoder.matches(req.getPassword(), principal.getPassword())) {
            throw new BadCredentialsException("Invalid credentials");
        }
        User user = principal.getUser();
        String token = tokenService.issue(user);
        log.info("User {} logged in", user.getId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", token);
        body.put("userId", user.getId());
        body.put("email", user.getEmail());
        body.put("roles", user.getRoles().stream().map(Role::authority).sorted().toList());
        return body;
    }

    // drops the caller's live token; the route itself requires authentication
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal AppUserDetails principal) {
        tokenService.revoke(principal.getId());
        log.info("User {} logged out", principal.getId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public ResponseEntity<?> me(@AuthenticationPrincipal AppUserDetails principal) {
        if (principal == null) return ResponseEntity.status(401).build();
        return ResponseEntity.ok(Map.of(
                "userId", principal.getId(),
                "email", principal.getUsername(),
                "admin", principal.isAdmin()));
    }

    @Data
    public static class LoginReq {
        @NotBlank @Email
        private String email;
        @NotBlank
        private String password;
    }
}
