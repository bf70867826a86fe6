package com.cloudferry.orchestrator.model;

public enum ActorRole {
    USER,
    ADMIN,
    SYSTEM
}
