package com.ridehub.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ridehub.dto.UserRequest;
import com.ridehub.dto.UserResponse;
import com.ridehub.entity.User;
import com.ridehub.exception.NotFoundException;
import com.ridehub.exception.ValidationException;
import com.ridehub.repository.RideEventRepository;
import com.ridehub.repository.RideRepository;
import com.ridehub.repository.UserRepository;

@Service
public class UserService {
    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final RideRepository rideRepository;
    private final RideEventRepository rideEventRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, RideRepository rideRepository,
                       RideEventRepository rideEventRepository, Clock clock) {
        this.userRepository = userRepository;
        this.rideRepository = rideRepository;
        this.rideEventRepository = rideEventRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Page<UserResponse> listUsers(User.Role role, String email, String username, String search,
                                        String ordering, Pageable pageable) {
        Specification<User> spec = Specification.where(null);
        if (role != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("role"), role));
        }
        if (email != null && !email.isBlank()) {
            String normalized = email.trim().toLowerCase(Locale.ROOT);
            spec = spec.and((root, query, cb) -> cb.equal(cb.lower(root.get("email")), normalized));
        }
        if (username != null && !username.isBlank()) {
            String exact = username.trim();
            spec = spec.and((root, query, cb) -> cb.equal(root.get("username"), exact));
        }
        if (search != null && !search.isBlank()) {
            String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.or(
                    cb.like(cb.lower(root.get("username")), pattern),
                    cb.like(cb.lower(root.get("firstName")), pattern),
                    cb.like(cb.lower(root.get("lastName")), pattern),
                    cb.like(cb.lower(root.get("email")), pattern),
                    cb.like(cb.lower(root.get("phoneNumber")), pattern)));
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), userSort(ordering));
        return userRepository.findAll(spec, sorted).map(UserResponse::from);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long id) {
        return UserResponse.from(findUser(id));
    }

    @Transactional
    public UserResponse createUser(UserRequest request) {
        requireFields(request);
        User user = new User();
        user.setRole(request.getRole() == null ? User.Role.RIDER : request.getRole());
        user.setActive(request.getActive() == null || request.getActive());
        user.setDateJoined(clock.instant());
        apply(user, request);
        checkUnique(user, null);
        User saved = userRepository.save(user);
        logger.info("User created: ID={}, username={}, role={}", saved.getId(), saved.getUsername(), saved.getRole());
        return UserResponse.from(saved);
    }

    @Transactional
    public UserResponse replaceUser(Long id, UserRequest request) {
        User user = findUser(id);
        requireFields(request);
        return saveUpdate(user, request);
    }

    @Transactional
    public UserResponse updateUser(Long id, UserRequest request) {
        return saveUpdate(findUser(id), request);
    }

    /** Deletes the user along with every ride they take part in and those rides' events. */
    @Transactional
    public void deleteUser(Long id) {
        User user = findUser(id);
        List<Long> rideIds = rideRepository.findIdsByParticipant(id);
        if (!rideIds.isEmpty()) {
            int events = rideEventRepository.deleteByRideIdIn(rideIds);
            rideRepository.deleteAllByIdIn(rideIds);
            logger.info("Cascaded delete of user {}: {} rides, {} events", id, rideIds.size(), events);
        }
        userRepository.delete(user);
        logger.info("User deleted: ID={}", id);
    }

    private UserResponse saveUpdate(User user, UserRequest request) {
        if (request.getRole() != null && request.getRole() != user.getRole()) {
            throw new ValidationException("role", "Role cannot be changed after creation.");
        }
        apply(user, request);
        if (request.getActive() != null) {
            user.setActive(request.getActive());
        }
        checkUnique(user, user.getId());
        User saved = userRepository.save(user);
        logger.info("User updated: ID={}", saved.getId());
        return UserResponse.from(saved);
    }

    private User findUser(Long id) {
        return userRepository.findById(id).orElseThrow(() -> NotFoundException.of("User", id));
    }

    private static void apply(User user, UserRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (request.getUsername() != null) {
            user.setUsername(notBlank(errors, "username", request.getUsername()));
        }
        if (request.getEmail() != null) {
            user.setEmail(notBlank(errors, "email", request.getEmail()));
        }
        if (request.getFirstName() != null) {
            user.setFirstName(notBlank(errors, "firstName", request.getFirstName()));
        }
        if (request.getLastName() != null) {
            user.setLastName(notBlank(errors, "lastName", request.getLastName()));
        }
        if (request.getPhoneNumber() != null) {
            String phone = request.getPhoneNumber().trim();
            user.setPhoneNumber(phone.isEmpty() ? null : phone);
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static String notBlank(Map<String, List<String>> errors, String field, String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            errors.computeIfAbsent(field, k -> new ArrayList<>()).add("This field may not be blank.");
        }
        return trimmed;
    }

    private static void requireFields(UserRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (request.getUsername() == null) errors.put("username", List.of("This field is required."));
        if (request.getEmail() == null) errors.put("email", List.of("This field is required."));
        if (request.getFirstName() == null) errors.put("firstName", List.of("This field is required."));
        if (request.getLastName() == null) errors.put("lastName", List.of("This field is required."));
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void checkUnique(User user, Long selfId) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        boolean usernameTaken = selfId == null
                ? userRepository.existsByUsername(user.getUsername())
                : userRepository.existsByUsernameAndIdNot(user.getUsername(), selfId);
        if (usernameTaken) {
            errors.put("username", List.of("A user with that username already exists."));
        }
        boolean emailTaken = selfId == null
                ? userRepository.existsByEmailIgnoreCase(user.getEmail())
                : userRepository.existsByEmailIgnoreCaseAndIdNot(user.getEmail(), selfId);
        if (emailTaken) {
            errors.put("email", List.of("A user with this email already exists."));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static Sort userSort(String ordering) {
        if (ordering == null || ordering.isBlank()) {
            return Sort.by(Sort.Order.asc("id"));
        }
        String value = ordering.trim();
        boolean descending = value.startsWith("-");
        String key = descending ? value.substring(1) : value;
        String property;
        switch (key) {
            case "username":
                property = "username";
                break;
            case "firstName":
            case "first_name":
                property = "firstName";
                break;
            case "lastName":
            case "last_name":
                property = "lastName";
                break;
            case "email":
                property = "email";
                break;
            case "id":
                return Sort.by(descending ? Sort.Order.desc("id") : Sort.Order.asc("id"));
            default:
                return Sort.by(Sort.Order.asc("id"));
        }
        Sort.Order order = descending ? Sort.Order.desc(property) : Sort.Order.asc(property);
        return Sort.by(order, Sort.Order.asc("id"));
    }
}
