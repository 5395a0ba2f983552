package dev.maplecms.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Plain message response")
public class MessageResponse {

    @Schema(description = "Response message", example = "Logged out")
    private String message;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static MessageResponse of(String message) {
        return MessageResponse.builder().message(message).build();
    }
}
