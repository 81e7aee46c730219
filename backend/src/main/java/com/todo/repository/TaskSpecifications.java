package com.todo.repository;

import com.todo.entity.Tag;
import com.todo.entity.Task;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * JPA specifications for task listings.
 *
 * Filtering specifications only contribute predicates. The ordering
 * specifications ({@link #orderedBy} and {@link #orderedByRelevance}) contribute
 * no predicate and instead set the ORDER BY clause, because priority and
 * relevance ordering are CASE expressions that a {@code Sort} cannot express.
 * They must be combined with an unsorted {@code Pageable}, and they skip count
 * queries, which must not carry an ORDER BY.
 *
 * Tag filtering uses an IN subquery rather than a join so that result rows stay
 * unique without DISTINCT (PostgreSQL rejects DISTINCT combined with ORDER BY
 * expressions that are not selected).
 */
public final class TaskSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private TaskSpecifications() {
    }

    public static Specification<Task> ownedBy(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }

    /**
     * Combines the owner restriction with every constraint set on the filter.
     */
    public static Specification<Task> matching(UUID userId, TaskFilter filter) {
        Specification<Task> spec = Specification.where(ownedBy(userId));
        if (filter == null) {
            return spec;
        }
        if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
            spec = spec.and(containsText(filter.getSearch()));
        }
        if (filter.getPriority() != null) {
            spec = spec.and(hasPriority(filter.getPriority()));
        }
        if (filter.getPriorities() != null && !filter.getPriorities().isEmpty()) {
            spec = spec.and(priorityIn(filter.getPriorities()));
        }
        if (filter.getIsCompleted() != null) {
            spec = spec.and(completed(filter.getIsCompleted()));
        }
        if (filter.getTagId() != null) {
            spec = spec.and(taggedWith(filter.getTagId()));
        }
        if (filter.isWithoutProject()) {
            spec = spec.and(withoutProject());
        } else if (filter.getProjectId() != null) {
            spec = spec.and(inProject(filter.getProjectId()));
        }
        if (filter.getDueOn() != null) {
            spec = spec.and(dueFrom(filter.getDueOn())).and(dueUntil(filter.getDueOn()));
        }
        if (filter.getDueFrom() != null) {
            spec = spec.and(dueFrom(filter.getDueFrom()));
        }
        if (filter.getDueTo() != null) {
            spec = spec.and(dueUntil(filter.getDueTo()));
        }
        return spec;
    }

    /**
     * Case-insensitive substring match on title or description.
     */
    public static Specification<Task> containsText(String text) {
        return (root, query, cb) -> {
            String pattern = containsPattern(text);
            return cb.or(
                    cb.like(cb.lower(root.<String>get("title")), pattern, LIKE_ESCAPE),
                    cb.like(cb.lower(root.<String>get("description")), pattern, LIKE_ESCAPE)
            );
        };
    }

    public static Specification<Task> hasPriority(Task.Priority priority) {
        return (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }

    public static Specification<Task> priorityIn(Collection<Task.Priority> priorities) {
        return (root, query, cb) -> root.get("priority").in(priorities);
    }

    public static Specification<Task> completed(boolean completed) {
        return (root, query, cb) -> cb.equal(root.get("isCompleted"), completed);
    }

    public static Specification<Task> taggedWith(UUID tagId) {
        return (root, query, cb) -> {
            Subquery<UUID> tagged = query.subquery(UUID.class);
            Root<Task> inner = tagged.from(Task.class);
            Join<Task, Tag> tags = inner.join("tags");
            tagged.select(inner.get("id")).where(cb.equal(tags.get("id"), tagId));
            return root.get("id").in(tagged);
        };
    }

    public static Specification<Task> inProject(UUID projectId) {
        return (root, query, cb) -> cb.equal(root.get("project").get("id"), projectId);
    }

    public static Specification<Task> withoutProject() {
        return (root, query, cb) -> cb.isNull(root.get("project"));
    }

    /**
     * Due on or after the start of {@code day}.
     */
    public static Specification<Task> dueFrom(LocalDate day) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<LocalDateTime>get("dueDate"), day.atStartOfDay());
    }

    /**
     * Due before the end of {@code day} (inclusive of the whole day).
     */
    public static Specification<Task> dueUntil(LocalDate day) {
        return (root, query, cb) -> cb.lessThan(root.<LocalDateTime>get("dueDate"), day.plusDays(1).atStartOfDay());
    }

    /**
     * Orders by a column sort key. PRIORITY always lists the most urgent first and
     * applies the direction to the creation-time tie-break.
     */
    public static Specification<Task> orderedBy(TaskSort sort, boolean ascending) {
        return (root, query, cb) -> {
            if (isCountQuery(query)) {
                return null;
            }
            List<Order> orders = new ArrayList<>();
            switch (sort) {
                case PRIORITY:
                    orders.add(cb.asc(priorityRank(root, cb)));
                    orders.add(direction(cb, root.get("createdAt"), ascending));
                    break;
                case DUE_DATE:
                    orders.add(direction(cb, root.get("dueDate"), ascending));
                    break;
                case TITLE:
                    orders.add(direction(cb, root.get("title"), ascending));
                    break;
                default:
                    orders.add(direction(cb, root.get("createdAt"), ascending));
                    break;
            }
            query.orderBy(orders);
            return null;
        };
    }

    /**
     * Orders by how well the task matches {@code text}: title prefix, then title
     * substring, then description substring, then everything else. Ties are broken
     * by creation time in the given direction.
     */
    public static Specification<Task> orderedByRelevance(String text, boolean ascending) {
        return (root, query, cb) -> {
            if (isCountQuery(query)) {
                return null;
            }
            Expression<String> title = cb.lower(root.<String>get("title"));
            Expression<String> description = cb.lower(root.<String>get("description"));
            Expression<Integer> relevance = cb.<Integer>selectCase()
                    .when(cb.like(title, startsWithPattern(text), LIKE_ESCAPE), 1)
                    .when(cb.like(title, containsPattern(text), LIKE_ESCAPE), 2)
                    .when(cb.like(description, containsPattern(text), LIKE_ESCAPE), 3)
                    .otherwise(4);
            query.orderBy(cb.asc(relevance), direction(cb, root.get("createdAt"), ascending));
            return null;
        };
    }

    public static String containsPattern(String text) {
        return "%" + escapeLike(text) + "%";
    }

    public static String startsWithPattern(String text) {
        return escapeLike(text) + "%";
    }

    private static String escapeLike(String text) {
        return text.trim()
                .toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private static Expression<Integer> priorityRank(Root<Task> root, CriteriaBuilder cb) {
        return cb.<Integer>selectCase()
                .when(cb.equal(root.get("priority"), Task.Priority.HIGH), Task.Priority.HIGH.getRank())
                .when(cb.equal(root.get("priority"), Task.Priority.MEDIUM), Task.Priority.MEDIUM.getRank())
                .otherwise(Task.Priority.LOW.getRank());
    }

    private static Order direction(CriteriaBuilder cb, Expression<?> expression, boolean ascending) {
        return ascending ? cb.asc(expression) : cb.desc(expression);
    }

    private static boolean isCountQuery(CriteriaQuery<?> query) {
        Class<?> resultType = query.getResultType();
        return Long.class.equals(resultType) || long.class.equals(resultType);
    }
}
