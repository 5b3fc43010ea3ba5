package com.pharmos.query;

import com.pharmos.domain.Role;
import com.pharmos.domain.User;

import static com.pharmos.query.Predicates.containsIfSet;
import static com.pharmos.query.Predicates.equalsIfSet;

/**
 * Filter input for the admin user listing.
 */
public class UserFilter implements EntityFilter<User> {

    private Role role;
    private String department;
    private Boolean active;
    private String email;

    @Override
    public boolean matches(User user) {
        return equalsIfSet(role, user.getRole())
            && containsIfSet(department, user.getDepartment())
            && equalsIfSet(active, user.isActive())
            && containsIfSet(email, user.getEmail());
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public String getDepartment() {
        return department;
    }

    public void setDepartment(String department) {
        this.department = department;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
