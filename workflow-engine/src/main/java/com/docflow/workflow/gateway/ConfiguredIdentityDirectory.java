package com.docflow.workflow.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link IdentityDirectory} over the users and roles listed in configuration.
 * The directory is read once at startup.
 */
@Component
public class ConfiguredIdentityDirectory implements IdentityDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredIdentityDirectory.class);

    private final Map<String, IdentityProperties.User> users;
    private final Set<String> roles;

    public ConfiguredIdentityDirectory(IdentityProperties properties) {
        this.users = properties.getUsers().stream()
                .collect(Collectors.toUnmodifiableMap(IdentityProperties.User::getId, Function.identity()));
        Set<String> allRoles = new LinkedHashSet<>(properties.getRoles());
        properties.getUsers().forEach(u -> allRoles.addAll(u.getRoles()));
        this.roles = Set.copyOf(allRoles);
        log.info("Identity directory loaded: {} users, {} roles", users.size(), roles.size());
    }

    @Override
    public boolean hasRole(String user, String role) {
        if (user == null) return false;
        IdentityProperties.User u = users.get(user);
        return u != null && u.isEnabled() && u.getRoles().contains(role);
    }

    @Override
    public Set<String> rolesOf(String user) {
        if (user == null) return Set.of();
        IdentityProperties.User u = users.get(user);
        return u == null ? Set.of() : Set.copyOf(u.getRoles());
    }

    @Override
    public Set<String> usersWithRole(String role) {
        return users.values().stream()
                .filter(IdentityProperties.User::isEnabled)
                .filter(u -> u.getRoles().contains(role))
                .map(IdentityProperties.User::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean userExists(String user) {
        return user != null && users.containsKey(user);
    }

    @Override
    public boolean roleExists(String role) {
        return role != null && roles.contains(role);
    }

    @Override
    public Set<String> enabledUsers() {
        return users.values().stream()
                .filter(IdentityProperties.User::isEnabled)
                .map(IdentityProperties.User::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
