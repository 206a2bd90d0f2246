package cn.bitsleep.recipebook.auth;

import cn.bitsleep.recipebook.domain.Role;
import cn.bitsleep.recipebook.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private TokenService tokenService;
    private User user;

    @BeforeEach
    void setUp() {
        tokenService = new TokenService();
        ReflectionTestUtils.setField(tokenService, "ttlSeconds", 3600L);
        user = User.builder().id(42L).email("cook@example.com").roles(Set.of(Role.USER)).build();
    }

    @Test
    @DisplayName("issue / validate: a fresh token resolves to its user")
    void issueAndValidate() {
        String token = tokenService.issue(user);

        assertEquals(42L, tokenService.validate(token));
    }

    @Test
    @DisplayName("validate: a newer token supersedes the previous one")
    void reissue_supersedes() throws InterruptedException {
        String first = tokenService.issue(user);
        Thread.sleep(1100); // iat has second precision
        String second = tokenService.issue(user);

        assertNotEquals(first, second);
        assertNull(tokenService.validate(first));
        assertEquals(42L, tokenService.validate(second));
    }

    @Test
    @DisplayName("validate: garbage, expired and revoked tokens are rejected")
    void invalidTokens() {
        assertNull(tokenService.validate("not-a-token"));

        ReflectionTestUtils.setField(tokenService, "ttlSeconds", -10L);
        assertNull(tokenService.validate(tokenService.issue(user)));

        ReflectionTestUtils.setField(tokenService, "ttlSeconds", 3600L);
        String token = tokenService.issue(user);
        tokenService.revoke(42L);
        assertNull(tokenService.validate(token));
    }
}
