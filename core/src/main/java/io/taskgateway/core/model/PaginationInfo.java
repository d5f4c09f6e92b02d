package io.taskgateway.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Pagination metadata of a task listing. Always derived locally from
 * {@code total/limit/offset}; upstream pagination blocks are never trusted
 * verbatim.
 *
 * @param currentPage 1-based page index, {@code floor(offset / limit) + 1}
 * @param pageSize    the page size ({@code limit})
 * @param totalCount  total number of items across all pages
 * @param totalPages  {@code ceil(total / limit)}
 * @param hasNext     {@code currentPage < totalPages}
 * @param hasPrev     {@code currentPage > 1}
 */
public record PaginationInfo(
        int currentPage, int pageSize, long totalCount, int totalPages, boolean hasNext, boolean hasPrev) {

    /**
     * Computes pagination from flat listing metadata. A non-positive
     * {@code limit} is treated as a single page holding everything; a
     * negative {@code offset} or {@code total} is clamped to zero, and page
     * numbers beyond {@link Integer#MAX_VALUE} saturate there.
     */
    public static PaginationInfo of(long total, int limit, long offset) {
        long safeTotal = Math.max(0, total);
        long safeOffset = Math.max(0, offset);
        if (limit <= 0) {
            return new PaginationInfo(1, limit, safeTotal, 1, false, false);
        }
        int currentPage = clampToInt(safeOffset / limit + 1);
        int totalPages = clampToInt(safeTotal / limit + (safeTotal % limit == 0 ? 0 : 1));
        return new PaginationInfo(
                currentPage, limit, safeTotal, totalPages, currentPage < totalPages, currentPage > 1);
    }

    /** Pagination for an unpaged listing of {@code size} items. */
    public static PaginationInfo singlePage(int size) {
        return new PaginationInfo(1, size, size, 1, false, false);
    }

    private static int clampToInt(long value) {
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    /** Renders the block with the contract's camelCase keys. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("currentPage", currentPage);
        node.put("pageSize", pageSize);
        node.put("totalCount", totalCount);
        node.put("totalPages", totalPages);
        node.put("hasNext", hasNext);
        node.put("hasPrev", hasPrev);
        return node;
    }
}
