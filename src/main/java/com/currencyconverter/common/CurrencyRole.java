package com.currencyconverter.common;

/**
 * Side of a conversion a currency code was supplied for.
 */
public enum CurrencyRole {
    SOURCE("Source"),
    DESTINATION("Destination");

    private final String label;

    CurrencyRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
