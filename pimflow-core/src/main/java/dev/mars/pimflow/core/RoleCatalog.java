/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pimflow.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed set of roles a deployment recognises.
 * Workflow definitions are checked against the catalog when they are registered,
 * so a stage can never require a role nobody can hold.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class RoleCatalog {

    public static final Role DATA_STEWARD = Role.of("DataSteward");
    public static final Role MARKETING = Role.of("Marketing");
    public static final Role ADMIN = Role.of("Admin");
    public static final Role COMPLIANCE_OFFICER = Role.of("ComplianceOfficer");

    private final Set<Role> roles;

    public RoleCatalog(Collection<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("Role catalog must contain at least one role");
        }
        this.roles = Set.copyOf(new LinkedHashSet<>(roles));
    }

    public static RoleCatalog of(String... names) {
        return new RoleCatalog(Arrays.stream(names).map(Role::of).collect(Collectors.toList()));
    }

    /**
     * The catalog used when no roles are configured: the data steward, marketing,
     * admin and compliance roles of the product and asset review flows.
     */
    public static RoleCatalog defaults() {
        return new RoleCatalog(Set.of(DATA_STEWARD, MARKETING, ADMIN, COMPLIANCE_OFFICER));
    }

    public boolean contains(Role role) {
        return role != null && roles.contains(role);
    }

    /**
     * Looks up a role by name ignoring case, returning the catalog's own spelling of it.
     * Role equality itself is exact; this is only a convenience for resolving user input.
     */
    public Optional<Role> find(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return roles.stream().filter(role -> role.getName().equalsIgnoreCase(wanted)).findFirst();
    }

    public Set<Role> getRoles() {
        return roles;
    }

    @Override
    public String toString() {
        return "RoleCatalog" + roles;
    }
}
