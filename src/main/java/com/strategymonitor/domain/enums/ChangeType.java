package com.strategymonitor.domain.enums;

/** Kind of structural change forwarded to the remote sync collaborator. */
public enum ChangeType {
    CREATED,
    UPDATED,
    DELETED
}
