package com.brainvault.service;

import com.brainvault.dto.request.UserUpdateRequest;
import com.brainvault.entity.User;
import com.brainvault.exception.ResourceNotFoundException;
import com.brainvault.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Directory of minimal account records keyed by the external auth id.
 *
 * Lifecycle:
 * - Created on first authenticated contact (get-or-create)
 * - Updated through explicit profile edits (email, subscription)
 * - Deleted on request; the owner's ideas are deleted with the account
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final IdeaService ideaService;

    @Transactional(readOnly = true)
    public Optional<User> findUser(String externalAuthId) {
        return userRepository.findByExternalAuthId(externalAuthId);
    }

    /**
     * Return the caller's record, creating it when absent.
     *
     * @param externalAuthId token subject
     * @param email email for a new record; ignored when the record exists
     * @param subscription tier for a new record, null for "free"
     * @throws IllegalArgumentException if a new record is needed and the email is missing or taken
     */
    @Transactional
    public User getOrCreateUser(String externalAuthId, String email, String subscription) {
        if (externalAuthId == null || externalAuthId.trim().isEmpty()) {
            throw new IllegalArgumentException("External auth id cannot be null or empty");
        }

        Optional<User> existing = userRepository.findByExternalAuthId(externalAuthId);
        if (existing.isPresent()) {
            return existing.get();
        }

        if (email == null || email.trim().isEmpty()) {
            log.warn("User creation rejected: no email for {}", externalAuthId);
            throw new IllegalArgumentException("Email is required to create a user");
        }
        if (userRepository.existsByEmail(email)) {
            log.warn("User creation rejected: email already registered");
            throw new IllegalArgumentException("Email is already registered");
        }

        User user = userRepository.save(new User(externalAuthId, email, subscription));
        log.info("User created: id={}, externalAuthId={}, subscription={}",
                user.getId(), externalAuthId, user.getSubscription());
        return user;
    }

    /**
     * @throws ResourceNotFoundException if the caller has no record
     * @throws IllegalArgumentException if the new email belongs to another user
     */
    @Transactional
    public User updateUser(String externalAuthId, UserUpdateRequest update) {
        User user = userRepository.findByExternalAuthId(externalAuthId)
                .orElseThrow(ResourceNotFoundException::user);

        if (update.getEmail() != null && !update.getEmail().equalsIgnoreCase(user.getEmail())) {
            if (userRepository.existsByEmail(update.getEmail())) {
                log.warn("User update rejected: email already registered");
                throw new IllegalArgumentException("Email is already registered");
            }
            user.setEmail(update.getEmail());
        }
        if (update.getSubscription() != null) {
            user.setSubscription(update.getSubscription());
        }

        User saved = userRepository.save(user);
        log.info("User updated: id={}, subscription={}", saved.getId(), saved.getSubscription());
        return saved;
    }

    /**
     * Delete the caller's record and all of their ideas.
     *
     * @throws ResourceNotFoundException if the caller has no record
     */
    @Transactional
    public void deleteUser(String externalAuthId) {
        User user = userRepository.findByExternalAuthId(externalAuthId)
                .orElseThrow(ResourceNotFoundException::user);

        int ideas = ideaService.deleteAllIdeas(externalAuthId);
        userRepository.delete(user);
        log.info("User deleted: id={}, ideasRemoved={}", user.getId(), ideas);
    }
}
