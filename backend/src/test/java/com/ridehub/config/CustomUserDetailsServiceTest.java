package com.ridehub.config;

import com.ridehub.entity.User;
import com.ridehub.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.security.core.userdetails.UsernameNotFoundException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class CustomUserDetailsServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private CustomUserDetailsService customUserDetailsService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void loadUserByUsername_AdminFound() {
        User admin = user("ops", User.Role.ADMIN, true);
        when(userRepository.findByUsername("ops")).thenReturn(Optional.of(admin));

        var userDetails = customUserDetailsService.loadUserByUsername("ops");

        assertNotNull(userDetails);
        assertEquals("ops", userDetails.getUsername());
        assertTrue(userDetails.isEnabled());
        assertTrue(userDetails.getAuthorities().stream().anyMatch(a -> a.getAuthority().equals("ADMIN")));
    }

    @Test
    void loadUserByUsername_RiderGetsRiderAuthority() {
        when(userRepository.findByUsername("rider1")).thenReturn(Optional.of(user("rider1", User.Role.RIDER, true)));

        var userDetails = customUserDetailsService.loadUserByUsername("rider1");

        assertTrue(userDetails.getAuthorities().stream().anyMatch(a -> a.getAuthority().equals("RIDER")));
        assertFalse(userDetails.getAuthorities().stream().anyMatch(a -> a.getAuthority().equals("ADMIN")));
    }

    @Test
    void loadUserByUsername_InactiveUserIsDisabled() {
        when(userRepository.findByUsername("gone")).thenReturn(Optional.of(user("gone", User.Role.ADMIN, false)));

        assertFalse(customUserDetailsService.loadUserByUsername("gone").isEnabled());
    }

    @Test
    void loadUserByUsername_NotFound() {
        when(userRepository.findByUsername("unknown")).thenReturn(Optional.empty());

        assertThrows(UsernameNotFoundException.class,
                () -> customUserDetailsService.loadUserByUsername("unknown"));
    }

    private static User user(String username, User.Role role, boolean active) {
        User user = new User();
        user.setUsername(username);
        user.setRole(role);
        user.setActive(active);
        return user;
    }
}
