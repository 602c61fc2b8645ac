package com.ridehub.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.ridehub.entity.User;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Create/update body for users. Absent fields are null; required-ness is
 * decided by the service per operation (create, full update, partial update).
 */
public class UserRequest {

    @Size(max = 150)
    private String username;

    @Email
    @Size(max = 255)
    private String email;

    private User.Role role;

    @JsonAlias("first_name")
    @Size(max = 100)
    private String firstName;

    @JsonAlias("last_name")
    @Size(max = 100)
    private String lastName;

    @JsonAlias("phone_number")
    @Size(max = 20)
    private String phoneNumber;

    @JsonAlias("is_active")
    private Boolean active;

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public User.Role getRole() { return role; }
    public void setRole(User.Role role) { this.role = role; }
    public String getFirstName() { return firstName; }
    public void setFirstName(String firstName) { this.firstName = firstName; }
    public String getLastName() { return lastName; }
    public void setLastName(String lastName) { this.lastName = lastName; }
    public String getPhoneNumber() { return phoneNumber; }
    public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
