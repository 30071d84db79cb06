package com.linkdeck.linkservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

@DisplayName("/api/admin/users")
class AdminUserControllerTest extends ApiTestSupport {

    private static final String USERS = "/api/admin/users";

    @BeforeEach
    void seedUsers() {
        seedUser("root", true);
        seedUser("alice", false);
        seedUser("bob", false);
    }

    @Test
    @DisplayName("no session is 401")
    void noSession() throws Exception {
        mvc.perform(get(USERS))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("users without the super-admin flag are denied")
    void notSuperAdmin() throws Exception {
        mvc.perform(post(USERS + "/alice/grant-access")
                        .header("Cookie", cookie("alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"admin\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"))
                .andExpect(jsonPath("$.permission").value("superadmin"));

        assertThat(column("alice", "app_role")).isEqualTo("none");
    }

    @Test
    @DisplayName("grants access and moves the user out of the pending list")
    void grant() throws Exception {
        mvc.perform(get(USERS).param("filter", "pending").header("Cookie", cookie("root")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users", hasSize(3)))
                .andExpect(jsonPath("$.users[0].appStatus").value("pending"));

        mvc.perform(post(USERS + "/alice/grant-access")
                        .header("Cookie", cookie("root"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"user\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Access granted successfully"))
                .andExpect(jsonPath("$.user.status").value("active"));

        mvc.perform(get(USERS).param("filter", "active").header("Cookie", cookie("root")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users", hasSize(1)))
                .andExpect(jsonPath("$.users[0].userId").value("alice"))
                .andExpect(jsonPath("$.users[0].appRole").value("user"))
                .andExpect(jsonPath("$.users[0].hasAccess").value(true));
    }

    @Test
    @DisplayName("changes the role, then revokes access")
    void changeThenRevoke() throws Exception {
        mvc.perform(post(USERS + "/bob/change-role")
                        .header("Cookie", cookie("root"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"admin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.role").value("admin"));
        assertThat(column("bob", "app_role")).isEqualTo("admin");

        mvc.perform(post(USERS + "/bob/revoke-access").header("Cookie", cookie("root")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Access revoked successfully"));

        assertThat(column("bob", "app_role")).isEqualTo("none");
        assertThat(column("bob", "app_status")).isEqualTo("revoked");
    }

    @Test
    @DisplayName("rejects roles other than user and admin")
    void invalidRole() throws Exception {
        mvc.perform(post(USERS + "/bob/grant-access")
                        .header("Cookie", cookie("root"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"owner\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ROLE"));
    }

    @Test
    @DisplayName("unknown users are 404")
    void unknownUser() throws Exception {
        mvc.perform(post(USERS + "/ghost/revoke-access").header("Cookie", cookie("root")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }

    private String column(String userId, String column) {
        return jdbc.query("SELECT " + column + " FROM users WHERE external_id = ?",
                rs -> rs.next() ? rs.getString(1) : null, userId);
    }
}
