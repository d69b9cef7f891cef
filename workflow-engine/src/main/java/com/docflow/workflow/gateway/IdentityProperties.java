package com.docflow.workflow.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static user/role directory bound from {@code docflow.identity.*}.
 *
 * <pre>
 * docflow:
 *   identity:
 *     roles: [Approver, System Manager]
 *     users:
 *       - id: alice
 *         roles: [Approver]
 * </pre>
 */
@ConfigurationProperties(prefix = "docflow.identity")
public class IdentityProperties {

    /** Roles that exist even when nobody holds them. */
    private Set<String> roles = new LinkedHashSet<>();

    private List<User> users = new ArrayList<>();

    public Set<String> getRoles()                { return roles; }
    public List<User>  getUsers()                { return users; }
    public void        setRoles(Set<String> roles) { this.roles = roles; }
    public void        setUsers(List<User> users)  { this.users = users; }

    public static class User {

        private String      id;
        private boolean     enabled = true;
        private Set<String> roles   = new LinkedHashSet<>();

        public User() {}

        public User(String id, boolean enabled, Set<String> roles) {
            this.id      = id;
            this.enabled = enabled;
            this.roles   = roles;
        }

        public String      getId()      { return id; }
        public boolean     isEnabled()  { return enabled; }
        public Set<String> getRoles()   { return roles; }

        public void setId(String id)               { this.id = id; }
        public void setEnabled(boolean enabled)    { this.enabled = enabled; }
        public void setRoles(Set<String> roles)    { this.roles = roles; }
    }
}
