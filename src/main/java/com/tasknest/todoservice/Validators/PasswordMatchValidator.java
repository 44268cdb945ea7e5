package com.tasknest.todoservice.Validators;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.BeanWrapperImpl;

import java.util.Objects;

public class PasswordMatchValidator implements ConstraintValidator<PasswordMatch, Object> {

    private String passwordField;
    private String passwordConfirmationField;

    @Override
    public void initialize(PasswordMatch constraint) {
        this.passwordField = constraint.passwordField();
        this.passwordConfirmationField = constraint.passwordConfirmationField();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) return true;
        BeanWrapperImpl wrapper = new BeanWrapperImpl(value);
        Object password = wrapper.getPropertyValue(passwordField);
        Object confirmation = wrapper.getPropertyValue(passwordConfirmationField);
        if (Objects.equals(password, confirmation)) {
            return true;
        }
        // report on the confirmation field so clients can highlight it
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode(passwordConfirmationField)
                .addConstraintViolation();
        return false;
    }
}
