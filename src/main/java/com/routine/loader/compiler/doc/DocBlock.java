package com.routine.loader.compiler.doc;

import java.util.List;

import lombok.Value;

/**
 * A doc block split into its parts.
 */
@Value
public class DocBlock {
    public static final DocBlock EMPTY = new DocBlock("", "", List.of());

    String shortDescription;
    String longDescription;
    List<DocBlockTag> tags;
}
