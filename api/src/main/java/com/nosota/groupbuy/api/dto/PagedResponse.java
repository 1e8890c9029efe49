package com.nosota.groupbuy.api.dto;

import java.util.List;

/**
 * Generic page of results.
 *
 * @param content       Page content
 * @param page          Page number (0-indexed)
 * @param size          Page size
 * @param totalElements Total number of elements
 */
public record PagedResponse<T>(
        List<T> content,
        int page,
        int size,
        int totalElements
) {
}
