package com.ridehub.dto;

import java.time.Instant;

import com.ridehub.entity.User;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UserResponse {
    private final Long id;
    private final String username;
    private final String email;
    private final User.Role role;
    private final String firstName;
    private final String lastName;
    private final String phoneNumber;
    private final boolean active;
    private final Instant dateJoined;

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.getRole(),
                user.getFirstName(), user.getLastName(), user.getPhoneNumber(), user.isActive(),
                user.getDateJoined());
    }
}
