package com.tableops.backend.modules.access.domain;

public enum AccessDecision {
    ALLOW,
    DENY
}
