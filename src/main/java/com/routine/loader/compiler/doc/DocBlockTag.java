package com.routine.loader.compiler.doc;

import lombok.Value;

/**
 * A tag of a doc block, e.g. {@code @param p_id The ID of the customer.}
 */
@Value
public class DocBlockTag {
    String name;

    /**
     * Everything after the tag name.
     */
    String content;

    /**
     * The content without its first word.
     */
    String description;
}
