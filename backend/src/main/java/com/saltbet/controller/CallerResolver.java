package com.saltbet.controller;

import com.saltbet.model.User;
import com.saltbet.repository.UserRepository;
import com.saltbet.web.BettingException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Looks up the account behind the {@value #USER_HEADER} request header.
 */
@Component
public class CallerResolver {

    public static final String USER_HEADER = "X-User-Id";

    private final UserRepository userRepository;

    public CallerResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User resolve(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> BettingException.userNotFound(userId));
    }
}
