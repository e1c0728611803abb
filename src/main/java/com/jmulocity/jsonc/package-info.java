/**
 * Directive-driven JSON encoding of request records.
 *
 * <p>Field directives are plain annotations: Gson's {@code @SerializedName} renames a field,
 * {@link com.jmulocity.jsonc.Omit} drops it, {@link com.jmulocity.jsonc.OmitEmpty} drops it when
 * empty, and {@link com.jmulocity.jsonc.Flat} splices a map or record into its parent. {@link
 * com.jmulocity.jsonc.JsonEncoder} is the entry point.
 */
package com.jmulocity.jsonc;
