package cn.bitsleep.recipebook.fixtures;

import cn.bitsleep.recipebook.domain.Role;
import cn.bitsleep.recipebook.domain.User;
import cn.bitsleep.recipebook.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One administrator and three regular accounts, all sharing the configured fixture password.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserFixtures {

    static final String ADMIN_EMAIL = "admin@example.com";
    static final int USER_COUNT = 3;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${recipebook.fixtures.password:user1234}")
    private String password;

    @Transactional
    public List<User> load() {
        List<User> users = new ArrayList<>();
        addIfMissing(users, ADMIN_EMAIL, Set.of(Role.USER, Role.ADMIN));
        for (int i = 0; i < USER_COUNT; i++) {
            addIfMissing(users, "user" + i + "@example.com", Set.of(Role.USER));
        }
        List<User> saved = userRepository.saveAll(users);
        log.info("Loaded {} user fixtures", saved.size());
        return saved;
    }

    private void addIfMissing(List<User> users, String email, Set<Role> roles) {
        if (userRepository.existsByEmail(email)) return;
        users.add(User.builder()
                .email(email)
                .password(passwordEncoder.encode(password))
                .roles(new HashSet<>(roles))
                .build());
    }
}
