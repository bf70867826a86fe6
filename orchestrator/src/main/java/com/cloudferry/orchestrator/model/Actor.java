package com.cloudferry.orchestrator.model;

/**
 * The party that initiates a retry, cancel or refund.
 * Recorded in the transition metadata for the audit trail.
 */
public record Actor(Long userId, ActorRole role) {

    public static Actor system() {
        return new Actor(null, ActorRole.SYSTEM);
    }

    public static Actor user(long userId) {
        return new Actor(userId, ActorRole.USER);
    }

    public static Actor admin(long userId) {
        return new Actor(userId, ActorRole.ADMIN);
    }

    /** Admins and the system may act on any Job; users only on their own. */
    public boolean mayActOn(Job job) {
        if (role != ActorRole.USER) {
            return true;
        }
        return userId != null && userId.equals(job.getOwnerId());
    }

    public StatusChangeSource source() {
        return role == ActorRole.SYSTEM ? StatusChangeSource.SYSTEM : StatusChangeSource.USER;
    }
}
