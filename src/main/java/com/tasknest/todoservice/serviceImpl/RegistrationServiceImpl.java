package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.SecurityConfig.LinkPurpose;
import com.tasknest.todoservice.SecurityConfig.LinkTokenCodec;
import com.tasknest.todoservice.SecurityConfig.PasswordHasher;
import com.tasknest.todoservice.dto.RegistrationRequest;
import com.tasknest.todoservice.dto.UserSummary;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.entity.UserRole;
import com.tasknest.todoservice.exception.RequestExceptions;
import com.tasknest.todoservice.exception.ResourceExceptions;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.repository.UserRepository;
import com.tasknest.todoservice.service.RegistrationService;
import com.tasknest.todoservice.utils.CredentialPolicy;
import com.tasknest.todoservice.utils.EmailTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationServiceImpl implements RegistrationService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final CredentialPolicy credentialPolicy;
    private final LinkTokenCodec linkTokenCodec;
    private final EmailTemplate emailTemplate;

    @Override
    @Transactional
    public UserSummary register(RegistrationRequest request) {
        final String username = request.getUsername();
        final String email = normalizeEmail(request.getEmail());

        credentialPolicy.checkUsername(username);
        credentialPolicy.checkPassword(request.getPassword());

        if (userRepository.existsByUsername(username)) {
            throw new UserExceptions.UsernameTaken(username);
        }
        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.EmailTaken(email);
        }

        User user = User.builder()
                .username(username)
                .email(email)
                .password(passwordHasher.hash(request.getPassword()))
                .role(UserRole.ROLE_USER)
                .isVerified(false)
                .build();
        User saved = userRepository.save(user);
        log.info("Registered username={}", saved.getUsername());

        // unverified is a valid resting state if this mail never arrives
        final String address = saved.getEmail();
        final String link = linkTokenCodec.encode(LinkPurpose.EMAIL_VERIFICATION, address);
        afterCommit(() -> emailTemplate.sendVerificationLink(address, link));

        return UserSummary.from(saved);
    }

    @Override
    @Transactional
    public void verifyEmail(String token) {
        String email = linkTokenCodec.decode(LinkPurpose.EMAIL_VERIFICATION, token)
                .orElseThrow(() -> new ResourceExceptions.NotFound("Verification link is invalid or has expired."));

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UserExceptions.UserNotFound("No account uses this email address."));

        if (user.isVerified()) {
            log.debug("Email already verified for username={}", user.getUsername());
            return;
        }
        user.setVerified(true);
        userRepository.save(user);
        log.info("Email verified for username={}", user.getUsername());
    }

    /** Runs once the surrounding transaction has committed; immediately when there is none. */
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new RequestExceptions.ValidationFailed("Email must be provided.");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
