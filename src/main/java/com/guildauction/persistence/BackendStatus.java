package com.guildauction.persistence;

public enum BackendStatus {
    ACTIVE,
    DEGRADED
}
