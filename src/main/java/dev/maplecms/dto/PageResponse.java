package dev.maplecms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One window of a listing, addressed by {@code skip}/{@code limit}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private List<T> content;
    private long skip;
    private int limit;
    private long totalElements;
    private boolean hasMore;

    public static <T> PageResponse<T> of(List<T> content, long skip, int limit, long totalElements) {
        return PageResponse.<T>builder()
                .content(content)
                .skip(skip)
                .limit(limit)
                .totalElements(totalElements)
                .hasMore(skip + content.size() < totalElements)
                .build();
    }
}
