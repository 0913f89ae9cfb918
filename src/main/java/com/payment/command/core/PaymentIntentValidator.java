package com.payment.command.core;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks the inputs of a charge before anything is created or sent to the gateway.
 */
public final class PaymentIntentValidator {

    private static final int MAX_FRACTION_DIGITS = 2;

    private PaymentIntentValidator() {
    }

    /**
     * @return a description of the first problem found, or empty when the intent is valid
     */
    public static Optional<String> validate(BigDecimal amount, String currency, String customerRef) {
        if (amount == null || amount.signum() <= 0) {
            return Optional.of("Amount must be greater than zero, was " + amount);
        }
        if (amount.stripTrailingZeros().scale() > MAX_FRACTION_DIGITS) {
            return Optional.of("Amount must have at most " + MAX_FRACTION_DIGITS + " decimal places, was " + amount);
        }
        if (!isRecognizedCurrency(currency)) {
            return Optional.of("Unrecognized currency code: " + currency);
        }
        if (customerRef == null || customerRef.isBlank()) {
            return Optional.of("Customer reference is required");
        }
        return Optional.empty();
    }

    public static boolean isRecognizedCurrency(String currency) {
        if (currency == null || currency.length() != 3 || !currency.equals(currency.toUpperCase(Locale.ROOT))) {
            return false;
        }
        try {
            Currency.getInstance(currency);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
