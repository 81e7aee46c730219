package com.todo.controller;

import com.todo.dto.request.TagRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.TagResponse;
import com.todo.security.CurrentUser;
import com.todo.service.TagService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tags")
@RequiredArgsConstructor
public class TagController {

    private final TagService tagService;
    private final MessageSourceAccessor messages;

    @GetMapping
    public ResponseEntity<ApiResponse<List<TagResponse>>> list(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(tagService.list(CurrentUser.userId(authentication))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TagResponse>> create(
            Authentication authentication,
            @Valid @RequestBody TagRequest request) {

        TagResponse tag = tagService.create(CurrentUser.userId(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(messages.getMessage("tag.created"), tag));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TagResponse>> update(
            Authentication authentication,
            @PathVariable UUID id,
            @Valid @RequestBody TagRequest request) {

        TagResponse tag = tagService.update(CurrentUser.userId(authentication), id, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("tag.updated"), tag));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            Authentication authentication,
            @PathVariable UUID id) {

        tagService.delete(CurrentUser.userId(authentication), id);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("tag.deleted")));
    }
}
