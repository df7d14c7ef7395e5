package com.makeithappen.backend.users.repo;

import com.makeithappen.backend.users.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepo extends JpaRepository<User, String> {
    Optional<User> findByEmailIgnoreCase(String email);
}
