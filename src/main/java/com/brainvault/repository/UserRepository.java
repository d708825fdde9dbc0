package com.brainvault.repository;

import com.brainvault.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for User entity operations.
 *
 * Users are looked up by the identity provider's subject id, which is what the
 * authentication filter places in the security context.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByExternalAuthId(String externalAuthId);

    boolean existsByEmail(String email);

    Optional<User> findByEmail(String email);
}
