package com.livebundle.core.session;

/**
 * Answers whether a build is currently executing for a session.
 */
@FunctionalInterface
public interface ActiveBuildGuard {

    ActiveBuildGuard NONE = sessionId -> false;

    boolean isBuilding(String sessionId);
}
