package com.datachain.logical;

/**
 * SQL join kinds. The planner only emits {@link #LEFT}.
 */
public enum JoinType {
    LEFT("LEFT JOIN"),
    INNER("INNER JOIN");

    private final String keyword;

    JoinType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
