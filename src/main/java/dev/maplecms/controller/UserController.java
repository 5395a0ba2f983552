package dev.maplecms.controller;

import dev.maplecms.dto.PageResponse;
import dev.maplecms.dto.UserRequest;
import dev.maplecms.dto.UserResponse;
import dev.maplecms.dto.UserUpdateRequest;
import dev.maplecms.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Users", description = "User management endpoints")
@SecurityRequirement(name = "Bearer Authentication")
@Slf4j
public class UserController {

    private final UserService userService;

    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Get current user")
    public Mono<UserResponse> getCurrentUser(Authentication authentication) {
        log.debug("Fetching current user profile");
        return userService.getCurrentUser(authentication.getName());
    }

    @PutMapping("/me")
    @PreAuthorize("isAuthenticated()")
    @Operation(summary = "Update current user", description = "Role and active flag cannot be changed here")
    public Mono<UserResponse> updateCurrentUser(
            @Valid @RequestBody UserUpdateRequest request,
            Authentication authentication) {
        log.info("Updating current user profile");
        return userService.updateCurrentUser(authentication.getName(), request);
    }

    @GetMapping
    @Operation(summary = "List users", description = "Newest first")
    public Mono<PageResponse<UserResponse>> listUsers(
            @Parameter(description = "Rows to skip") @RequestParam(defaultValue = "0") @Min(0) long skip,
            @Parameter(description = "Page size (max 100)") @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        log.debug("Admin listing users: skip={}, limit={}", skip, limit);
        return userService.listUsers(skip, limit);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get user by id")
    public Mono<UserResponse> getUser(@PathVariable Long id) {
        log.debug("Admin fetching user by id: {}", id);
        return userService.getUserById(id);
    }

    @PostMapping
    @Operation(summary = "Create user")
    public Mono<ResponseEntity<UserResponse>> createUser(@Valid @RequestBody UserRequest request) {
        log.info("Creating new user");
        return userService.createUser(request)
                .map(user -> ResponseEntity.status(HttpStatus.CREATED).body(user));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update user", description = "Null fields are left unchanged")
    public Mono<UserResponse> updateUser(@PathVariable Long id, @Valid @RequestBody UserUpdateRequest request) {
        log.info("Updating user: id={}", id);
        return userService.updateUser(id, request);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete user", description = "Refused while the user still authors articles")
    public Mono<ResponseEntity<Void>> deleteUser(@PathVariable Long id, Authentication authentication) {
        log.info("Deleting user: id={}", id);
        return userService.deleteUser(id, authentication.getName())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
