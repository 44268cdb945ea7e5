package com.tasknest.todoservice.serviceImpl;

import com.tasknest.todoservice.SecurityConfig.LinkPurpose;
import com.tasknest.todoservice.SecurityConfig.LinkTokenCodec;
import com.tasknest.todoservice.SecurityConfig.PasswordHasher;
import com.tasknest.todoservice.entity.User;
import com.tasknest.todoservice.exception.RequestExceptions;
import com.tasknest.todoservice.exception.ResourceExceptions;
import com.tasknest.todoservice.exception.UserExceptions;
import com.tasknest.todoservice.repository.UserRepository;
import com.tasknest.todoservice.service.PasswordResetService;
import com.tasknest.todoservice.utils.CredentialPolicy;
import com.tasknest.todoservice.utils.EmailTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetServiceImpl implements PasswordResetService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final CredentialPolicy credentialPolicy;
    private final LinkTokenCodec linkTokenCodec;
    private final EmailTemplate emailTemplate;

    @Override
    @Transactional(readOnly = true)
    public void requestReset(String email) {
        if (email == null || email.isBlank()) {
            return;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        Optional<User> user = userRepository.findByEmail(normalized);
        if (user.isEmpty()) {
            log.debug("Password reset requested for an unknown address");
            return;
        }
        emailTemplate.sendPasswordResetLink(normalized,
                linkTokenCodec.encode(LinkPurpose.PASSWORD_RESET, normalized));
        log.info("Password reset link issued for username={}", user.get().getUsername());
    }

    @Override
    @Transactional
    public void resetPassword(String token, String password, String confirmPassword) {
        if (!Objects.equals(password, confirmPassword)) {
            throw new RequestExceptions.ValidationFailed("Passwords do not match.");
        }
        credentialPolicy.checkPassword(password);

        String email = linkTokenCodec.decode(LinkPurpose.PASSWORD_RESET, token)
                .orElseThrow(() -> new ResourceExceptions.NotFound("Reset link is invalid or has expired."));

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UserExceptions.UserNotFound("No account uses this email address."));

        user.setPassword(passwordHasher.hash(password));
        userRepository.save(user);
        log.info("Password reset for username={}", user.getUsername());
    }
}
