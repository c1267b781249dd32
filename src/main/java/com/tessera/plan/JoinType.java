package com.tessera.plan;

public enum JoinType {
    INNER,
    LEFT
}
