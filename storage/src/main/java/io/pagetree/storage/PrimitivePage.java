package io.pagetree.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.pagetree.core.PageFlags;

/**
 * Flat, JSON-friendly form of a page.
 * <p>
 * Exactly one of {@code field} / {@code fieldRef} and one of {@code comment} /
 * {@code commentRef} is set; {@link PrimitivePages#toPage} rejects anything else.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrimitivePage(int index,
                            String field,
                            Integer fieldRef,
                            String comment,
                            Integer commentRef,
                            PageFlags flags) {
}
