package com.docflow.workflow.gateway;

import java.util.Set;

/**
 * Users and roles as far as the engine needs them. Authentication and
 * the wider permission model live outside the engine.
 */
public interface IdentityDirectory {

    /** False for disabled users, matching {@link #usersWithRole}. */
    boolean hasRole(String user, String role);

    Set<String> rolesOf(String user);

    /** Enabled users holding the role. Disabled users are never returned. */
    Set<String> usersWithRole(String role);

    boolean userExists(String user);

    boolean roleExists(String role);

    Set<String> enabledUsers();
}
