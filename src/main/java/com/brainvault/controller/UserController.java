package com.brainvault.controller;

import com.brainvault.dto.request.UserCreateRequest;
import com.brainvault.dto.request.UserUpdateRequest;
import com.brainvault.dto.response.UserResponse;
import com.brainvault.entity.User;
import com.brainvault.exception.ResourceNotFoundException;
import com.brainvault.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account endpoints for the authenticated caller.
 *
 * The record is keyed by the token subject. GET /users/me creates the record on first
 * contact when the token carries an email claim.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserService userService;

    @PostMapping
    public ResponseEntity<UserResponse> createUser(
            @Valid @RequestBody UserCreateRequest request,
            Authentication authentication) {

        log.info("User registration request from: {}", authentication.getName());

        User user = userService.getOrCreateUser(
                authentication.getName(), request.getEmail(), request.getSubscription());

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(UserResponse.from(user));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> getCurrentUser(Authentication authentication) {
        String externalAuthId = authentication.getName();
        String email = authentication.getDetails() instanceof String ? (String) authentication.getDetails() : null;

        User user = userService.findUser(externalAuthId)
                .orElseGet(() -> {
                    if (email == null) {
                        throw ResourceNotFoundException.user();
                    }
                    return userService.getOrCreateUser(externalAuthId, email, null);
                });

        return ResponseEntity.ok(UserResponse.from(user));
    }

    @PutMapping("/me")
    public ResponseEntity<UserResponse> updateCurrentUser(
            @Valid @RequestBody UserUpdateRequest request,
            Authentication authentication) {

        log.info("User update request from: {}", authentication.getName());
        return ResponseEntity.ok(UserResponse.from(userService.updateUser(authentication.getName(), request)));
    }

    @DeleteMapping("/me")
    public ResponseEntity<Void> deleteCurrentUser(Authentication authentication) {
        log.info("User delete request from: {}", authentication.getName());
        userService.deleteUser(authentication.getName());
        return ResponseEntity.noContent().build();
    }
}
