package com.ridehub.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import com.ridehub.IntegrationTestSupport;
import com.ridehub.entity.User;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@WithMockUser(username = "ops", authorities = "ADMIN")
class UserControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void createsDriver() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "drew", "email": "drew@example.com", "role": "DRIVER",
                                 "firstName": "Drew", "lastName": "Barry", "phoneNumber": "555-0101"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("driver"))
                .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(get("/api/users/drivers"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].username").value("drew"));
        mockMvc.perform(get("/api/users/riders"))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void rejectsInvalidEmail() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "drew", "email": "not-an-email", "firstName": "Drew", "lastName": "Barry"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fields.email").exists());
    }

    @Test
    void rejectsRoleChange() throws Exception {
        User rider = saveUser("ruth", User.Role.RIDER);

        mockMvc.perform(patch("/api/users/{id}", rider.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"admin\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.role").exists());
    }

    @Test
    void filtersByRoleParameter() throws Exception {
        saveUser("ruth", User.Role.RIDER);
        saveUser("dale", User.Role.DRIVER);

        mockMvc.perform(get("/api/users").param("role", "rider"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].username").value("ruth"));
        mockMvc.perform(get("/api/users").param("role", "pilot"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deletesUser() throws Exception {
        User rider = saveUser("ruth", User.Role.RIDER);

        mockMvc.perform(delete("/api/users/{id}", rider.getId()))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/users/{id}", rider.getId()))
                .andExpect(status().isNotFound());
    }
}
