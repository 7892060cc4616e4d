package com.datachain.types;

/**
 * Sort direction for ORDER BY entries. ASC when not given.
 */
public enum Sorting {
    ASC,
    DESC
}
