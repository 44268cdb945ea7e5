package com.tasknest.todoservice.service;

public interface PasswordResetService {

    /**
     * Mail a reset link if an account uses {@code email}. Completes normally either way,
     * so callers cannot probe which addresses are registered.
     */
    void requestReset(String email);

    void resetPassword(String token, String password, String confirmPassword);
}
