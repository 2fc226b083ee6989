package com.qoeboost.api.repository;

import com.qoeboost.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities in durable mode.
 *
 * Spring Data JPA derives the queries from the method names:
 * - findByUsername -> SELECT * FROM users WHERE username = ?
 * - existsByEmail  -> SELECT COUNT(*) > 0 FROM users WHERE email = ?
 *
 * Only used through JpaPersistenceGateway; callers go through the
 * PersistenceGateway interface so they work unchanged on the fallback store.
 *
 * @see com.qoeboost.api.storage.JpaPersistenceGateway
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Username comparison is case-sensitive: "Alice" and "alice" are
     * different accounts.
     */
    Optional<User> findByUsername(String username);

    Optional<User> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);
}
