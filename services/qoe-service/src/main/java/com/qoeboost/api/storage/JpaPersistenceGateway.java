package com.qoeboost.api.storage;

import com.qoeboost.api.entity.Feedback;
import com.qoeboost.api.entity.NetworkLog;
import com.qoeboost.api.entity.User;
import com.qoeboost.api.exception.ConflictException;
import com.qoeboost.api.exception.NotFoundException;
import com.qoeboost.api.repository.FeedbackRepository;
import com.qoeboost.api.repository.NetworkLogRepository;
import com.qoeboost.api.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * JpaPersistenceGateway - durable store backed by PostgreSQL.
 *
 * Uniqueness is checked up front for a precise error message, and the
 * unique constraints on users.username and users.email catch the race where
 * two registrations pass the check concurrently.
 *
 * Transaction Behavior:
 * - writes run in a read-write transaction each; no write spans collections
 * - reads run read-only
 */
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaPersistenceGateway implements PersistenceGateway {

    private final UserRepository userRepository;
    private final FeedbackRepository feedbackRepository;
    private final NetworkLogRepository networkLogRepository;

    @Override
    public StorageMode storageMode() {
        return StorageMode.DURABLE;
    }

    @Override
    @Transactional
    public User createUser(User user) {
        if (userRepository.existsByUsername(user.getUsername())) {
            throw new ConflictException("Username already registered");
        }
        if (userRepository.existsByEmail(user.getEmail())) {
            throw new ConflictException("Email already registered");
        }
        try {
            User saved = userRepository.saveAndFlush(user.toBuilder().id(null).build());
            log.debug("Stored user in database: id={}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration lost on unique constraint: username={}", user.getUsername());
            throw new ConflictException("Username or email already registered");
        }
    }

    @Override
    public Optional<User> findUserById(Long id) {
        return userRepository.findById(id);
    }

    @Override
    public Optional<User> findUserByUsername(String username) {
        return userRepository.findByUsername(username);
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Override
    @Transactional
    public User updateUserActive(Long id, boolean active) {
        User user = userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("User not found"));
        user.setActive(active);
        return userRepository.save(user);
    }

    @Override
    @Transactional
    public Feedback createFeedback(Feedback feedback) {
        requireUser(feedback.getUserId());
        return feedbackRepository.save(feedback.toBuilder().id(null).build());
    }

    @Override
    public List<Feedback> listFeedback(Long userId, int offset, int limit) {
        OffsetLimitRequest page = new OffsetLimitRequest(Paging.of(offset, limit));
        return userId == null
                ? feedbackRepository.findAllBy(page)
                : feedbackRepository.findByUserId(userId, page);
    }

    @Override
    @Transactional
    public NetworkLog createNetworkLog(NetworkLog networkLog) {
        requireUser(networkLog.getUserId());
        return networkLogRepository.save(networkLog.toBuilder().id(null).build());
    }

    @Override
    public List<NetworkLog> listNetworkLogs(Long userId, int offset, int limit) {
        OffsetLimitRequest page = new OffsetLimitRequest(Paging.of(offset, limit));
        return userId == null
                ? networkLogRepository.findAllBy(page)
                : networkLogRepository.findByUserId(userId, page);
    }

    @Override
    public List<NetworkLog> findNetworkLogsByLocation(String location) {
        return networkLogRepository.findByLocation(location, Sort.by(Sort.Direction.ASC, "id"));
    }

    private void requireUser(Long userId) {
        if (userId != null && !userRepository.existsById(userId)) {
            throw new NotFoundException("User not found");
        }
    }
}
