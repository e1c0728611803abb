/**
 * Contains classes for error handling and status reporting.
 *
 * <p>This package provides a consistent way to represent operation outcomes without relying on
 * exceptions for control flow. The central classes are:
 *
 * <ul>
 *   <li>{@link com.jmulocity.common.status.StatusCode} - Enum of error sources: schema, transport,
 *       decode, remote and client misuse</li>
 *   <li>{@link com.jmulocity.common.status.Status} - A status with an optional message, cause and,
 *       for remote failures, the HTTP status and the platform's error payload</li>
 *   <li>{@link com.jmulocity.common.status.StatusOr} - Container that holds either a successful
 *       value or an error status</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Optional&lt;MeasurementCollection&gt;&gt; pageOr = pager.nextPage(current);
 * if (pageOr.isNotOk()) {
 *     Logger.error("Paging failed: {}", pageOr.getStatus());
 *     return;
 * }
 * if (pageOr.getValue().isEmpty()) {
 *     // No further pages.
 *     return;
 * }
 * MeasurementCollection next = pageOr.getValue().get();
 * </pre>
 */
package com.jmulocity.common.status;
