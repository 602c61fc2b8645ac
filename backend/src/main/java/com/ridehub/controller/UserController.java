package com.ridehub.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import com.ridehub.dto.PageResponse;
import com.ridehub.dto.UserRequest;
import com.ridehub.dto.UserResponse;
import com.ridehub.entity.User;
import com.ridehub.exception.ValidationException;
import com.ridehub.service.UserService;

import jakarta.servlet.http.HttpServletRequest;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;
    private final Paginator paginator;

    public UserController(UserService userService, Paginator paginator) {
        this.userService = userService;
        this.paginator = paginator;
    }

    @GetMapping
    public PageResponse<UserResponse> listUsers(@RequestParam(required = false) String role,
                                                @RequestParam(required = false) String email,
                                                @RequestParam(required = false) String username,
                                                @RequestParam(required = false) String search,
                                                @RequestParam(required = false) String ordering,
                                                @RequestParam(required = false) Integer page,
                                                @RequestParam(name = "page_size", required = false) Integer pageSize,
                                                HttpServletRequest request) {
        User.Role parsedRole;
        try {
            parsedRole = User.Role.fromValue(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("role", e.getMessage());
        }
        return paginator.envelope(userService.listUsers(parsedRole, email, username, search, ordering,
                paginator.pageable(page, pageSize)), request);
    }

    @GetMapping("/riders")
    public PageResponse<UserResponse> riders(@RequestParam(required = false) Integer page,
                                             @RequestParam(name = "page_size", required = false) Integer pageSize,
                                             HttpServletRequest request) {
        return paginator.envelope(userService.listUsers(User.Role.RIDER, null, null, null, null,
                paginator.pageable(page, pageSize)), request);
    }

    @GetMapping("/drivers")
    public PageResponse<UserResponse> drivers(@RequestParam(required = false) Integer page,
                                              @RequestParam(name = "page_size", required = false) Integer pageSize,
                                              HttpServletRequest request) {
        return paginator.envelope(userService.listUsers(User.Role.DRIVER, null, null, null, null,
                paginator.pageable(page, pageSize)), request);
    }

    @GetMapping("/{id}")
    public UserResponse getUser(@PathVariable Long id) {
        return userService.getUser(id);
    }

    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Validated @RequestBody UserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.createUser(request));
    }

    @PutMapping("/{id}")
    public UserResponse replaceUser(@PathVariable Long id, @Validated @RequestBody UserRequest request) {
        return userService.replaceUser(id, request);
    }

    @PatchMapping("/{id}")
    public UserResponse updateUser(@PathVariable Long id, @Validated @RequestBody UserRequest request) {
        return userService.updateUser(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteUser(@PathVariable Long id) {
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
