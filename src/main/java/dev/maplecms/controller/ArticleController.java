package dev.maplecms.controller;

import dev.maplecms.dto.ArticleFilter;
import dev.maplecms.dto.ArticleRequest;
import dev.maplecms.dto.ArticleResponse;
import dev.maplecms.dto.ArticleUpdateRequest;
import dev.maplecms.dto.PageResponse;
import dev.maplecms.entity.ArticleStatus;
import dev.maplecms.service.ArticleService;
import dev.maplecms.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/articles")
@RequiredArgsConstructor
@Validated
@Tag(name = "Articles", description = "Article endpoints")
@Slf4j
public class ArticleController {

    private final ArticleService articleService;
    private final UserService userService;

    @GetMapping
    @Operation(summary = "List articles", description = "Newest first, optionally filtered by status, author and category")
    public Mono<PageResponse<ArticleResponse>> listArticles(
            @Parameter(description = "DRAFT, PUBLISHED or ARCHIVED")
            @RequestParam(required = false) @Pattern(regexp = "^(DRAFT|PUBLISHED|ARCHIVED)$", message = "Invalid status") String status,
            @RequestParam(required = false) Long authorId,
            @RequestParam(required = false) Long categoryId,
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Page size (max 100)") @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        log.debug("Listing articles: status={}, authorId={}, categoryId={}, skip={}, limit={}",
                status, authorId, categoryId, skip, limit);
        ArticleFilter filter = ArticleFilter.builder()
                .status(status != null ? ArticleStatus.parse(status) : null)
                .authorId(authorId)
                .categoryId(categoryId)
                .build();
        return articleService.listArticles(filter, skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get article by id")
    public Mono<ArticleResponse> getArticle(@PathVariable Long id) {
        return articleService.getArticle(id);
    }

    @GetMapping("/slug/{slug}")
    @Operation(summary = "Get article by slug")
    public Mono<ArticleResponse> getArticleBySlug(
            @PathVariable @Pattern(regexp = "^[a-z0-9-]+$", message = "Invalid slug format") String slug) {
        return articleService.getArticleBySlug(slug);
    }

    @PostMapping
    @PreAuthorize("hasRole('AUTHOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Create article", description = "The caller becomes the author")
    public Mono<ResponseEntity<ArticleResponse>> createArticle(
            @Valid @RequestBody ArticleRequest request,
            Authentication authentication) {
        log.info("Creating article '{}'", request.getTitle());
        return userService.findByEmail(authentication.getName())
                .flatMap(author -> articleService.createArticle(request, author.getId()))
                .map(article -> ResponseEntity.status(HttpStatus.CREATED).body(article));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('AUTHOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Update article", description = "Partial update by the author or an editor")
    public Mono<ArticleResponse> updateArticle(
            @PathVariable Long id,
            @Valid @RequestBody ArticleUpdateRequest request,
            Authentication authentication) {
        log.info("Updating article id={}", id);
        return articleService.verifyCanModify(id, authentication.getName())
                .then(Mono.defer(() -> articleService.updateArticle(id, request)));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('AUTHOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Delete article")
    public Mono<ResponseEntity<Void>> deleteArticle(@PathVariable Long id, Authentication authentication) {
        log.info("Deleting article id={}", id);
        return articleService.verifyCanModify(id, authentication.getName())
                .then(Mono.defer(() -> articleService.deleteArticle(id)))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
