package com.tessera.plan;

import com.tessera.query.SortDirection;

/**
 * Represents an ORDER BY entry over a member alias
 */
public final class OrderByItem {
    private final String member;
    private final SortDirection direction;

    public OrderByItem(String member, SortDirection direction) {
        this.member = member;
        this.direction = direction;
    }

    public String getMember() {
        return member;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public boolean isAscending() {
        return direction == SortDirection.ASC;
    }

    @Override
    public String toString() {
        return member + " " + direction.getValue();
    }
}
