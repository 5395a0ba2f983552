package dev.maplecms.controller;

import dev.maplecms.dto.CategoryRequest;
import dev.maplecms.dto.CategoryResponse;
import dev.maplecms.dto.PageResponse;
import dev.maplecms.service.CategoryService;
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
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
@Validated
@Tag(name = "Categories", description = "Category endpoints")
@Slf4j
public class CategoryController {

    private final CategoryService categoryService;

    @GetMapping
    @Operation(summary = "List categories", description = "Ordered by name")
    public Mono<PageResponse<CategoryResponse>> listCategories(
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Page size (max 100)") @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        log.debug("Listing categories: skip={}, limit={}", skip, limit);
        return categoryService.listCategories(skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get category by id")
    public Mono<CategoryResponse> getCategory(@PathVariable Long id) {
        return categoryService.getCategoryById(id);
    }

    @GetMapping("/slug/{slug}")
    @Operation(summary = "Get category by slug")
    public Mono<CategoryResponse> getCategoryBySlug(
            @PathVariable @Pattern(regexp = "^[a-z0-9-]+$", message = "Invalid slug format") String slug) {
        return categoryService.getCategoryBySlug(slug);
    }

    @PostMapping
    @PreAuthorize("hasRole('EDITOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Create category")
    public Mono<ResponseEntity<CategoryResponse>> createCategory(@Valid @RequestBody CategoryRequest request) {
        log.info("Creating category '{}'", request.getName());
        return categoryService.createCategory(request)
                .map(category -> ResponseEntity.status(HttpStatus.CREATED).body(category));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('EDITOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Update category", description = "Null fields are left unchanged")
    public Mono<CategoryResponse> updateCategory(@PathVariable Long id, @Valid @RequestBody CategoryRequest request) {
        log.info("Updating category id={}", id);
        return categoryService.updateCategory(id, request);
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('EDITOR')")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Delete category", description = "Articles in the category are left uncategorized")
    public Mono<ResponseEntity<Void>> deleteCategory(@PathVariable Long id) {
        log.info("Deleting category id={}", id);
        return categoryService.deleteCategory(id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
