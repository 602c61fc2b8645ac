package com.ridehub.dto;

import com.ridehub.entity.User;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Inlined rider/driver details on ride views. */
@Getter
@AllArgsConstructor
public class UserSummary {
    private final Long id;
    private final String username;
    private final String email;
    private final User.Role role;
    private final String firstName;
    private final String lastName;
    private final String phoneNumber;

    public static UserSummary from(User user) {
        return new UserSummary(user.getId(), user.getUsername(), user.getEmail(), user.getRole(),
                user.getFirstName(), user.getLastName(), user.getPhoneNumber());
    }
}
