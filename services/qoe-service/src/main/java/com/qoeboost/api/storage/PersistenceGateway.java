package com.qoeboost.api.storage;

import com.qoeboost.api.entity.Feedback;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.entity.User;

import java.util.List;
import java.util.Optional;

/**
 * PersistenceGateway - record-oriented access to users, feedback and network logs.
 *
 * Two implementations exist, selected once at startup by StorageConfig:
 * - JpaPersistenceGateway: PostgreSQL through Spring Data JPA
 * - InMemoryPersistenceGateway: in-process fallback when PostgreSQL is unreachable
 *
 * Both behave the same from the caller's side:
 * - ids are assigned by the store; listings are ordered by id ascending
 * - createUser fails with ConflictException when the username or the email is taken
 * - a non-null userId on feedback or network logs must name an existing user,
 *   otherwise NotFoundException
 * - list operations validate offset and limit (see Paging) and never return
 *   more than limit records
 *
 * Returned records are detached copies; mutating them has no effect on the store.
 */
public interface PersistenceGateway {

    StorageMode storageMode();

    /**
     * @param user new user without id
     * @return the stored user with its assigned id
     * @throws com.qoeboost.api.exception.ConflictException if username or email is taken
     */
    User createUser(User user);

    Optional<User> findUserById(Long id);

    Optional<User> findUserByUsername(String username);

    Optional<User> findUserByEmail(String email);

    /**
     * The only mutation a user record admits.
     *
     * @throws com.qoeboost.api.exception.NotFoundException if no such user
     */
    User updateUserActive(Long id, boolean active);

    Feedback createFeedback(Feedback feedback);

    /**
     * @param userId owner to filter by, or null for all records
     */
    List<Feedback> listFeedback(Long userId, int offset, int limit);

    NetworkLog createNetworkLog(NetworkLog networkLog);

    /**
     * @param userId owner to filter by, or null for all records
     */
    List<NetworkLog> listNetworkLogs(Long userId, int offset, int limit);

    /**
     * All logs recorded for exactly this location label, in insertion order.
     */
    List<NetworkLog> findNetworkLogsByLocation(String location);
}
