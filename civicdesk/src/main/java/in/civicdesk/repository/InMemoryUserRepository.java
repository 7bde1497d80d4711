package in.civicdesk.repository;

import in.civicdesk.domain.common.ValidationException;
import in.civicdesk.domain.repository.UserRepository;
import in.civicdesk.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory user table with secondary indexes on email and national ID.
 * The uniqueness check and the insert happen under one write lock.
 */
public final class InMemoryUserRepository implements UserRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryUserRepository.class);

    private final Map<String, User> byId = new HashMap<>();
    private final Map<String, String> idByEmail = new HashMap<>();
    private final Map<String, String> idByNationalId = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void insert(User user) {
        lock.writeLock().lock();
        try {
            if (byId.containsKey(user.userId())) {
                throw new IllegalStateException("Duplicate user id: " + user.userId());
            }
            if (user.email() != null && idByEmail.containsKey(user.email())) {
                throw new ValidationException("Email already registered");
            }
            if (user.nationalId() != null && idByNationalId.containsKey(user.nationalId())) {
                throw new ValidationException("National ID already registered");
            }
            byId.put(user.userId(), user);
            if (user.email() != null) {
                idByEmail.put(user.email(), user.userId());
            }
            if (user.nationalId() != null) {
                idByNationalId.put(user.nationalId(), user.userId());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("User stored: {}", user.userId());
    }

    @Override
    public Optional<User> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<User> findByIdentifier(String identifier) {
        List<User> matches = new ArrayList<>(2);
        if (identifier == null) {
            return matches;
        }
        lock.readLock().lock();
        try {
            String emailOwner = idByEmail.get(identifier);
            if (emailOwner != null) {
                matches.add(byId.get(emailOwner));
            }
            String nationalIdOwner = idByNationalId.get(identifier);
            if (nationalIdOwner != null && !nationalIdOwner.equals(emailOwner)) {
                matches.add(byId.get(nationalIdOwner));
            }
        } finally {
            lock.readLock().unlock();
        }
        return matches;
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            String userId = idByEmail.get(email);
            return userId != null ? Optional.ofNullable(byId.get(userId)) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }
}
