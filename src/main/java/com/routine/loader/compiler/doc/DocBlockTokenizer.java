package com.routine.loader.compiler.doc;

/**
 * Splits the comment preceding a stored routine into a short description, a long description and tags.
 */
public interface DocBlockTokenizer {

    DocBlock tokenize(String text);
}
