package dev.maplecms.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create or update a category. The name is mandatory on create; on update a
 * {@code null} field is left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRequest {

    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    @Size(max = 64, message = "Name must be at most 64 characters")
    private String name;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    private String description;
}
