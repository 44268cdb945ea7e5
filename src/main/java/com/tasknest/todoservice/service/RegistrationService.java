package com.tasknest.todoservice.service;

import com.tasknest.todoservice.dto.RegistrationRequest;
import com.tasknest.todoservice.dto.UserSummary;

public interface RegistrationService {

    /** Create an unverified account and mail its verification link. */
    UserSummary register(RegistrationRequest request);

    /** Mark the account named by a verification link as verified. */
    void verifyEmail(String token);
}
