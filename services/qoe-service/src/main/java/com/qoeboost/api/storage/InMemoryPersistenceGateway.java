package com.qoeboost.api.storage;

import com.qoeboost.api.entity.Feedback;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.entity.User;
import com.qoeboost.api.exception.ConflictException;
import com.qoeboost.api.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * InMemoryPersistenceGateway - fallback store used when PostgreSQL was
 * unreachable at startup.
 *
 * Single-process and non-durable. Each collection has its own lock and its
 * own id counter starting at 1. The user existence check on feedback and
 * network-log writes reads the user collection outside the target
 * collection's lock, so it is advisory: there is no foreign key to hold it.
 *
 * @see InMemoryCollection
 */
@Slf4j
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final InMemoryCollection<User> users = new InMemoryCollection<>(
            (user, id) -> user.toBuilder().id(id).build(), User::getId, user -> user.toBuilder().build());

    private final InMemoryCollection<Feedback> feedback = new InMemoryCollection<>(
            (item, id) -> item.toBuilder().id(id).build(), Feedback::getId, item -> item.toBuilder().build());

    private final InMemoryCollection<NetworkLog> networkLogs = new InMemoryCollection<>(
            (entry, id) -> entry.toBuilder().id(id).build(), NetworkLog::getId, entry -> entry.toBuilder().build());

    @Override
    public StorageMode storageMode() {
        return StorageMode.FALLBACK;
    }

    @Override
    public User createUser(User user) {
        User stored = users.insert(user, existing -> {
            for (User other : existing) {
                if (other.getUsername().equals(user.getUsername())) {
                    throw new ConflictException("Username already registered");
                }
                if (other.getEmail().equals(user.getEmail())) {
                    throw new ConflictException("Email already registered");
                }
            }
        });
        log.debug("Stored user in memory: id={}", stored.getId());
        return stored;
    }

    @Override
    public Optional<User> findUserById(Long id) {
        return users.findFirst(user -> user.getId().equals(id));
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        return users.findFirst(user -> user.getUsername().equals(username));
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        return users.findFirst(user -> user.getEmail().equals(email));
    }

    @Override
    public User updateUserActive(Long id, boolean active) {
        return users.replace(id, user -> {
                    user.setActive(active);
                    return user;
                })
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    @Override
    public Feedback createFeedback(Feedback item) {
        requireUser(item.getUserId());
        return feedback.insert(item);
    }

    @Override
    public List<Feedback> listFeedback(Long userId, int offset, int limit) {
        Paging paging = Paging.of(offset, limit);
        return feedback.select(item -> ownedBy(item.getUserId(), userId), paging.getOffset(), paging.getLimit());
    }

    @Override
    public NetworkLog createNetworkLog(NetworkLog networkLog) {
        requireUser(networkLog.getUserId());
        return networkLogs.insert(networkLog);
    }

    @Override
    public List<NetworkLog> listNetworkLogs(Long userId, int offset, int limit) {
        Paging paging = Paging.of(offset, limit);
        return networkLogs.select(entry -> ownedBy(entry.getUserId(), userId), paging.getOffset(), paging.getLimit());
    }

    @Override
    public List<NetworkLog> findNetworkLogsByLocation(String location) {
        return networkLogs.selectAll(entry -> entry.getLocation().equals(location));
    }

    private void requireUser(Long userId) {
        if (userId != null && findUserById(userId).isEmpty()) {
            throw new NotFoundException("User not found");
        }
    }

    private static boolean ownedBy(Long owner, Long filter) {
        return filter == null || Objects.equals(owner, filter);
    }
}
