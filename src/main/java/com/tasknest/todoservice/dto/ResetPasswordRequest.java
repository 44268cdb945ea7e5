package com.tasknest.todoservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tasknest.todoservice.Validators.PasswordMatch;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@PasswordMatch(passwordField = "password", passwordConfirmationField = "confirmPassword")
public class ResetPasswordRequest {

    @NotBlank(message = "Password cannot be empty")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @NotBlank(message = "Password confirmation is required")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String confirmPassword;
}
