package com.jmulocity.generic;

import javax.annotation.Nullable;

/**
 * Paging information the platform attaches to collection responses. Every field may be missing
 * from a response; {@code totalPages} and {@code totalRecords} are only reported when requested
 * with {@code withTotalPages=true}.
 */
public record PagingStatistics(
    @Nullable Integer totalRecords,
    @Nullable Integer totalPages,
    @Nullable Integer pageSize,
    @Nullable Integer currentPage) {}
