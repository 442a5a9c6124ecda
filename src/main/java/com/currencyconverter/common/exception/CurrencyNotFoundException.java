package com.currencyconverter.common.exception;

import com.currencyconverter.common.CurrencyRole;

/**
 * Thrown when a currency code is not recognised or has no rate valid right now.
 */
public class CurrencyNotFoundException extends CurrencyConverterException {

    private final String currencyCode;
    private final CurrencyRole role;

    public CurrencyNotFoundException(String message) {
        super(message);
        this.currencyCode = null;
        this.role = null;
    }

    private CurrencyNotFoundException(String message, String currencyCode, CurrencyRole role) {
        super(message);
        this.currencyCode = currencyCode;
        this.role = role;
    }

    public static CurrencyNotFoundException unknown(String currencyCode, CurrencyRole role) {
        return new CurrencyNotFoundException(
            String.format("%s currency \"%s\" not found", role.getLabel(), currencyCode),
            currencyCode, role);
    }

    public static CurrencyNotFoundException noCurrentRate(String currencyCode, CurrencyRole role) {
        return new CurrencyNotFoundException(
            String.format("No current rate found for %s currency %s",
                role.getLabel().toLowerCase(), currencyCode),
            currencyCode, role);
    }

    public String getCurrencyCode() {
        return currencyCode;
    }

    public CurrencyRole getRole() {
        return role;
    }
}
