package com.todo.service;

import com.todo.dto.request.TagRequest;
import com.todo.dto.response.TagResponse;
import com.todo.entity.Tag;
import com.todo.entity.User;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.ValidationException;
import com.todo.repository.TagRepository;
import com.todo.repository.TaskRepository;
import com.todo.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TagService Unit Tests")
class TagServiceTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private TagService tagService;

    private UUID userId;
    private User user;
    private Tag tag;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        user = new User("Jane", "jane@example.com", "hash");
        user.setId(userId);
        tag = new Tag(user, "urgent", "#EF4444");
        tag.setId(UUID.randomUUID());
    }

    @Test
    @DisplayName("list should carry the number of tasks per tag")
    void testList() {
        List<Object[]> counts = new ArrayList<>();
        counts.add(new Object[]{tag.getId(), 7L});
        when(taskRepository.countGroupedByTag(userId)).thenReturn(counts);
        when(tagRepository.findByUserIdOrderByNameAsc(userId)).thenReturn(List.of(tag));

        List<TagResponse> tags = tagService.list(userId);

        assertEquals(1, tags.size());
        assertEquals(7L, tags.get(0).getTaskCount());
    }

    @Test
    @DisplayName("create should reject a name differing only in case")
    void testCreate_Duplicate() {
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));
        when(tagRepository.existsByUserIdAndNameIgnoreCase(userId, "URGENT")).thenReturn(true);

        assertThrows(ValidationException.class, () -> tagService.create(userId, new TagRequest("URGENT", "#000000")));
        verify(tagRepository, never()).save(any());
    }

    @Test
    @DisplayName("update may keep its own name")
    void testUpdate_SameName() {
        when(tagRepository.findById(tag.getId())).thenReturn(Optional.of(tag));
        when(tagRepository.existsByUserIdAndNameIgnoreCaseAndIdNot(userId, "urgent", tag.getId())).thenReturn(false);
        when(tagRepository.save(tag)).thenReturn(tag);
        when(taskRepository.countGroupedByTag(userId)).thenReturn(new ArrayList<>());

        TagResponse response = tagService.update(userId, tag.getId(), new TagRequest("urgent", "#22C55E"));

        assertEquals("#22C55E", response.getColor());
        assertEquals(0L, response.getTaskCount());
    }

    @Test
    @DisplayName("delete should unlink the tag from tasks before removing it")
    void testDelete() {
        when(tagRepository.findById(tag.getId())).thenReturn(Optional.of(tag));

        tagService.delete(userId, tag.getId());

        verify(tagRepository).detachFromTasks(tag.getId());
        verify(tagRepository).delete(tag);
    }

    @Test
    @DisplayName("delete of an unknown tag should be not found")
    void testDelete_NotFound() {
        UUID missing = UUID.randomUUID();
        when(tagRepository.findById(missing)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> tagService.delete(userId, missing));
    }
}
