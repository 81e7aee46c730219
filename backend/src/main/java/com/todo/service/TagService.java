package com.todo.service;

import com.todo.dto.request.TagRequest;
import com.todo.dto.response.TagResponse;
import com.todo.entity.Tag;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.TagRepository;
import com.todo.repository.TaskRepository;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for tags. Names are unique per user, case-insensitively.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TagService {

    static final String NAME_TAKEN = "validation.name.unique";

    private final TagRepository tagRepository;
    private final TaskRepository taskRepository;
    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<TagResponse> list(UUID userId) {
        Map<UUID, Long> counts = TaskCounts.byTag(taskRepository.countGroupedByTag(userId));
        return tagRepository.findByUserIdOrderByNameAsc(userId).stream()
                .map(tag -> TagResponse.from(tag, counts.getOrDefault(tag.getId(), 0L)))
                .toList();
    }

    @Transactional
    public TagResponse create(UUID userId, TagRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));

        String name = request.getName().trim();
        if (tagRepository.existsByUserIdAndNameIgnoreCase(userId, name)) {
            throw ValidationException.of("name", NAME_TAKEN);
        }

        Tag tag = tagRepository.save(new Tag(user, name, request.getColor()));
        log.info("Tag created: {} ({}) for user {}", tag.getId(), name, userId);
        return TagResponse.from(tag, 0);
    }

    @Transactional
    public TagResponse update(UUID userId, UUID tagId, TagRequest request) {
        Tag tag = getOwnedTag(userId, tagId);

        String name = request.getName().trim();
        if (tagRepository.existsByUserIdAndNameIgnoreCaseAndIdNot(userId, name, tagId)) {
            throw ValidationException.of("name", NAME_TAKEN);
        }
        tag.setName(name);
        if (request.getColor() != null) {
            tag.setColor(request.getColor());
        }

        tag = tagRepository.save(tag);
        long count = TaskCounts.byTag(taskRepository.countGroupedByTag(userId)).getOrDefault(tagId, 0L);
        return TagResponse.from(tag, count);
    }

    /**
     * Delete the tag after removing it from every task.
     */
    @Transactional
    public void delete(UUID userId, UUID tagId) {
        Tag tag = getOwnedTag(userId, tagId);
        int detached = tagRepository.detachFromTasks(tagId);
        tagRepository.delete(tag);
        log.info("Tag {} deleted for user {} (removed from {} tasks)", tagId, userId, detached);
    }

    private Tag getOwnedTag(UUID userId, UUID tagId) {
        Tag tag = tagRepository.findById(tagId)
                .orElseThrow(() -> ResourceNotFoundException.of("Tag", tagId));
        if (!tag.isOwnedBy(userId)) {
            log.warn("User {} attempted to access tag {} owned by another user", userId, tagId);
            throw UnauthorizedException.accessDenied("tag", tagId);
        }
        return tag;
    }
}
