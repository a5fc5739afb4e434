package com.nosota.lingodesk.api.dto;

import java.util.List;

/**
 * Offset pagination envelope used by the API-key surface.
 *
 * @param totalCount Number of records matching the filter, across all pages
 * @param results    Records of the requested page
 * @param <T>        Record type
 */
public record PagedResponse<T>(
        long totalCount,
        List<T> results
) {
}
