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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Roles and the role catalog")
class RoleCatalogTest {

    @Nested
    @DisplayName("Role")
    class RoleTests {

        @Test
        @DisplayName("Role names compare exactly")
        void roleNamesAreCaseSensitive() {
            Role steward = Role.of("DataSteward");

            assertEquals(steward, Role.of("DataSteward"));
            assertEquals(steward.hashCode(), Role.of("DataSteward").hashCode());
            assertNotEquals(steward, Role.of("datasteward"));
            assertNotEquals(RoleCatalog.ADMIN, Role.of("ADMIN"));
        }

        @Test
        @DisplayName("Role names are trimmed and may not be blank")
        void roleNamesValidated() {
            assertEquals("Marketing", Role.of("  Marketing ").getName());
            assertThrows(IllegalArgumentException.class, () -> Role.of("   "));
            assertThrows(NullPointerException.class, () -> Role.of(null));
        }

        @Test
        @DisplayName("Roles serialize as plain JSON strings")
        void roleJson() throws Exception {
            ObjectMapper mapper = new ObjectMapper();

            assertEquals("\"Marketing\"", mapper.writeValueAsString(RoleCatalog.MARKETING));
            assertEquals(RoleCatalog.MARKETING, mapper.readValue("\"Marketing\"", Role.class));
        }
    }

    @Nested
    @DisplayName("RoleCatalog")
    class CatalogTests {

        @Test
        void defaultsContainReviewRoles() {
            RoleCatalog catalog = RoleCatalog.defaults();

            assertTrue(catalog.contains(RoleCatalog.DATA_STEWARD));
            assertTrue(catalog.contains(RoleCatalog.MARKETING));
            assertTrue(catalog.contains(RoleCatalog.ADMIN));
            assertTrue(catalog.contains(RoleCatalog.COMPLIANCE_OFFICER));
            assertFalse(catalog.contains(Role.of("Photographer")));
            assertFalse(catalog.contains(Role.of("datasteward")));
            assertFalse(catalog.contains(null));
        }

        @Test
        void findReturnsCatalogSpelling() {
            RoleCatalog catalog = RoleCatalog.of("DataSteward", "Marketing");

            Optional<Role> found = catalog.find("DATASTEWARD");

            assertTrue(found.isPresent());
            assertEquals("DataSteward", found.get().getName());
            assertTrue(catalog.find("Admin").isEmpty());
            assertTrue(catalog.find(" ").isEmpty());
        }

        @Test
        void emptyCatalogRejected() {
            assertThrows(IllegalArgumentException.class, () -> new RoleCatalog(List.of()));
        }

        @Test
        void duplicateRolesCollapse() {
            RoleCatalog catalog = RoleCatalog.of("Marketing", "Marketing", "Admin");
            assertEquals(2, catalog.getRoles().size());
        }
    }

    @Nested
    @DisplayName("Actor")
    class ActorTests {

        @Test
        void systemActorIsAdmin() {
            Actor system = Actor.system();

            assertEquals(Actor.SYSTEM_ID, system.getUserId());
            assertEquals(RoleCatalog.ADMIN, system.getRole());
        }

        @Test
        void actorEqualityUsesUserAndRole() {
            assertEquals(Actor.of("alice", RoleCatalog.DATA_STEWARD), Actor.of("alice", Role.of("DataSteward")));
            assertNotEquals(Actor.of("alice", RoleCatalog.DATA_STEWARD), Actor.of("alice", Role.of("datasteward")));
            assertNotEquals(Actor.of("alice", RoleCatalog.DATA_STEWARD), Actor.of("alice", RoleCatalog.MARKETING));
        }

        @Test
        void actorJson() throws Exception {
            ObjectMapper mapper = new ObjectMapper();
            Actor actor = Actor.of("bob", RoleCatalog.MARKETING);

            String json = mapper.writeValueAsString(actor);

            assertEquals(actor, mapper.readValue(json, Actor.class));
        }
    }
}
