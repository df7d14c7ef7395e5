package com.makeithappen.backend.users.dto;

import com.makeithappen.backend.users.entity.User;

import java.time.Instant;

public class UserDtos {

    public record MeResponse(String id, String email, String name, Instant createdAt) {
        public static MeResponse of(User u) {
            return new MeResponse(u.getId(), u.getEmail(), u.getName(), u.getCreatedAt());
        }
    }
}
