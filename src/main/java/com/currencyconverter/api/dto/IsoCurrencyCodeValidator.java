package com.currencyconverter.api.dto;

import com.currencyconverter.common.CurrencyCodes;
import com.currencyconverter.currency.IsoCurrencyMetadata;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class IsoCurrencyCodeValidator implements ConstraintValidator<IsoCurrencyCode, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        String code = CurrencyCodes.normalize(value);
        return code.isEmpty() || IsoCurrencyMetadata.isIsoCode(code);
    }
}
