package workout.logger.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import workout.logger.api.entity.User;
import workout.logger.api.repository.UserRepository;
import workout.logger.api.security.Principal;

import java.util.Optional;

@Slf4j
@Service
public class UserService {
    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Registers the caller on first sight so the ownership root row exists,
     * and keeps the stored email in line with the token.
     * Two first requests of the same user may race on the insert; the loser reads the winner's row.
     * Not transactional itself: a failed insert must not poison the transaction the re-read runs in.
     */
    public User getOrCreateUser(Principal principal) {
        Optional<User> existingUser = userRepository.findById(principal.getId());
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (principal.getEmail() != null && !principal.getEmail().equals(user.getEmail())) {
                user.setEmail(principal.getEmail());
                userRepository.save(user);
            }
            return user;
        }

        User user = new User();
        user.setId(principal.getId());
        user.setEmail(principal.getEmail());
        try {
            User created = userRepository.saveAndFlush(user);
            log.info("Registered user {}", principal.getId());
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("User {} was registered concurrently, reading it back", principal.getId());
            return userRepository.findById(principal.getId()).orElseThrow(() -> e);
        }
    }
}
