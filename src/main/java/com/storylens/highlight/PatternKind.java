package com.storylens.highlight;

/**
 * Where a search pattern came from on its entity.
 */
public enum PatternKind {
    NAME,
    TAG
}
