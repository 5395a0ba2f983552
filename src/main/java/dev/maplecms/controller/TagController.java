package dev.maplecms.controller;

import dev.maplecms.dto.PageResponse;
import dev.maplecms.dto.TagRequest;
import dev.maplecms.dto.TagResponse;
import dev.maplecms.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
@Validated
@io.swagger.v3.oas.annotations.tags.Tag(name = "Tags", description = "Tag endpoints")
@Slf4j
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "List tags", description = "Ordered by name")
    public Mono<PageResponse<TagResponse>> listTags(
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Page size (max 100)") @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        log.debug("Listing tags: skip={}, limit={}", skip, limit);
        return tagService.listTags(skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get tag by id")
    public Mono<TagResponse> getTag(@PathVariable Long id) {
        return tagService.getTagById(id);
    }

    @GetMapping("/slug/{slug}")
    @Operation(summary = "Get tag by slug")
    public Mono<TagResponse> getTagBySlug(
            @Parameter(description = "Tag slug", required = true)
            @PathVariable @Pattern(regexp = "^[a-z0-9-]+$", message = "Invalid slug format") String slug) {
        log.debug("Fetching tag by slug={}", slug);
        return tagService.getTagBySlug(slug);
    }

    @PostMapping
    @PreAuthorize("hasRole('AUTHOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Create tag")
    public Mono<ResponseEntity<TagResponse>> createTag(@Valid @RequestBody TagRequest request) {
        log.info("Creating tag '{}'", request.getName());
        return tagService.createTag(request)
                .map(tag -> ResponseEntity.status(HttpStatus.CREATED).body(tag));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('EDITOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Rename tag")
    public Mono<TagResponse> updateTag(@PathVariable Long id, @Valid @RequestBody TagRequest request) {
        log.info("Updating tag id={}", id);
        return tagService.updateTag(id, request);
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Delete tag", description = "Removes the tag from every article")
    public Mono<ResponseEntity<Void>> deleteTag(@PathVariable Long id) {
        log.info("Deleting tag id={}", id);
        return tagService.deleteTag(id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
