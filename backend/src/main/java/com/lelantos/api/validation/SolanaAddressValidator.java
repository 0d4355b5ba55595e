package com.lelantos.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Jakarta Bean Validation adapter for {@link AddressValidator}.
 */
public class SolanaAddressValidator implements ConstraintValidator<SolanaAddress, String> {

    private final AddressValidator addressValidator = new AddressValidator();

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidAddress(value);
    }
}
