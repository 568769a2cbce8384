package com.taildeck.backend.modules.identity.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.taildeck.backend.modules.identity.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findBySubject(String subject);
}
