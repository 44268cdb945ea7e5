package com.tasknest.todoservice.utils;

import com.tasknest.todoservice.exception.RequestExceptions;
import org.springframework.stereotype.Component;

/**
 * Username and password rules applied at registration and password reset.
 * The first broken rule is reported as a 422 naming that rule.
 */
@Component
public class CredentialPolicy {

    public static final int USERNAME_MIN = 5;
    public static final int USERNAME_MAX = 30;
    public static final int PASSWORD_MIN = 9;
    public static final int PASSWORD_MAX = 30;

    static final String FORBIDDEN_USERNAME_CHARS = "$%\\/<>:^?!";

    public void checkUsername(String username) {
        if (username == null || username.length() < USERNAME_MIN || username.length() > USERNAME_MAX) {
            throw new RequestExceptions.ValidationFailed(
                    "Username must contain " + USERNAME_MIN + " to " + USERNAME_MAX + " characters.");
        }
        for (int i = 0; i < username.length(); i++) {
            char c = username.charAt(i);
            if (FORBIDDEN_USERNAME_CHARS.indexOf(c) >= 0) {
                throw new RequestExceptions.ValidationFailed(
                        "Username must not contain any of " + FORBIDDEN_USERNAME_CHARS + " (found '" + c + "').");
            }
        }
    }

    public void checkPassword(String password) {
        if (password == null || password.length() < PASSWORD_MIN || password.length() > PASSWORD_MAX) {
            throw new RequestExceptions.ValidationFailed(
                    "Password must contain " + PASSWORD_MIN + " to " + PASSWORD_MAX + " characters.");
        }
        boolean hasLetter = false;
        boolean hasDigit = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isLetter(c)) hasLetter = true;
            else if (Character.isDigit(c)) hasDigit = true;
        }
        if (!hasDigit) {
            throw new RequestExceptions.ValidationFailed("Password must contain at least one digit.");
        }
        if (!hasLetter) {
            throw new RequestExceptions.ValidationFailed("Password must contain at least one letter.");
        }
    }
}
