package com.makeithappen.backend.users.controller;

import com.makeithappen.backend.auth.security.AuthContext;
import com.makeithappen.backend.users.dto.UserDtos;
import com.makeithappen.backend.users.repo.UserRepo;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/users")
public class UserMeController {

    private final UserRepo users;
    private final AuthContext auth;

    public UserMeController(UserRepo users, AuthContext auth) {
        this.users = users;
        this.auth = auth;
    }

    @GetMapping("/me")
    @Transactional(readOnly = true)
    public UserDtos.MeResponse me() {
        String uid = auth.requireUserId();
        return users.findById(uid)
                .map(UserDtos.MeResponse::of)
                .orElseThrow(() -> new NoSuchElementException("USER_NOT_FOUND"));
    }
}
