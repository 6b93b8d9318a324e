package com.turdes.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.turdes.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByEmail(String email);

    boolean existsByEmail(String email);

    Optional<AppUser> findByIdAndRefreshTokenHash(Long id, String refreshTokenHash);
}
