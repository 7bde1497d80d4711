package in.civicdesk.repository;

import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueFilter;
import in.civicdesk.domain.repository.IssueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * In-memory issue table.
 *
 * THREAD-SAFETY:
 * One ReentrantReadWriteLock guards the whole table. Queries share the read
 * lock; insert and update take the write lock, and update runs its mutation
 * while holding it, so request handlers and the escalation scheduler never
 * interleave on the same record.
 *
 * ORDERING:
 * LinkedHashMap keeps insertion order; an update replaces the value in place
 * and does not move the entry. Queries walk it backwards (newest first).
 */
public final class InMemoryIssueRepository implements IssueRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryIssueRepository.class);

    private final Map<String, Issue> issues = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void insert(Issue issue) {
        Objects.requireNonNull(issue, "issue");
        lock.writeLock().lock();
        try {
            if (issues.containsKey(issue.id())) {
                throw new IllegalStateException("Duplicate issue id: " + issue.id());
            }
            issues.put(issue.id(), issue);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Issue stored: {}", issue.id());
    }

    @Override
    public Optional<Issue> findById(String issueId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(issues.get(issueId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Issue> findAll(IssueFilter filter) {
        IssueFilter effective = filter != null ? filter : IssueFilter.all();
        List<Issue> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Issue issue : issues.values()) {
                if (effective.matches(issue)) {
                    result.add(issue);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        Collections.reverse(result);
        return result;
    }

    @Override
    public Optional<Issue> update(String issueId, UnaryOperator<Issue> mutation) {
        lock.writeLock().lock();
        try {
            Issue current = issues.get(issueId);
            if (current == null) {
                return Optional.empty();
            }
            Issue next = mutation.apply(current);
            if (next == null || !next.id().equals(issueId)) {
                throw new IllegalStateException("Mutation must return an issue with id " + issueId);
            }
            issues.put(issueId, next);
            return Optional.of(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return issues.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
