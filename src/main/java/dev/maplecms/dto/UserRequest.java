package dev.maplecms.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin-side user creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 48, message = "Username must be between 3 and 48 characters")
    @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "Username may contain letters, digits, '.', '_' and '-' only")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email must be at most 255 characters")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
    private String password;

    @Pattern(regexp = "^(ADMIN|EDITOR|AUTHOR|VIEWER)?$", message = "Role must be ADMIN, EDITOR, AUTHOR or VIEWER")
    private String role;

    private Boolean active;
}
