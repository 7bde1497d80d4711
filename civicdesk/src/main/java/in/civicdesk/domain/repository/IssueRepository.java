package in.civicdesk.domain.repository;

import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueFilter;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Authoritative store of issues.
 * Implementations serialize writers against readers so that an update
 * cannot be lost to a concurrent one.
 */
public interface IssueRepository {
    /**
     * Insert a new issue. Fails if the id is already taken.
     */
    void insert(Issue issue);

    /**
     * Find issue by ID.
     */
    Optional<Issue> findById(String issueId);

    /**
     * Find issues matching the filter, most recently inserted first.
     */
    List<Issue> findAll(IssueFilter filter);

    /**
     * Atomically replace an issue with the result of the mutation.
     * The mutation runs under the store's write lock and may return the
     * same instance to signal "no change".
     *
     * @return the stored issue after the mutation, or empty if the id is unknown
     */
    Optional<Issue> update(String issueId, UnaryOperator<Issue> mutation);

    /**
     * Number of stored issues.
     */
    int count();
}
