package tech.terrareg.platform.shared;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pagination block returned by list and search endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageMeta(
    int limit,
    @JsonProperty("current_offset") int currentOffset,
    @JsonProperty("next_offset") Integer nextOffset,
    @JsonProperty("prev_offset") Integer prevOffset
) {

    public static final int MAX_LIMIT = 50;

    public static int clampLimit(Integer limit, int defaultLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public static int clampOffset(Integer offset) {
        return offset == null ? 0 : Math.max(0, offset);
    }

    public static PageMeta of(int limit, int offset, long total) {
        Integer next = offset + limit < total ? offset + limit : null;
        Integer prev = offset > 0 ? Math.max(0, offset - limit) : null;
        return new PageMeta(limit, offset, next, prev);
    }
}
