package com.storefront.catalog.normalize;

import com.storefront.catalog.model.CanonicalRecord;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Renders prices the way the catalog files show them.
 * <pre>
 * (19.99, USD)   → "$19.99"
 * (19.99, EUR)   → "EUR 19.99"
 * (null, null)   → "Unavailable"
 * flag "Free"    → "Free", whatever the amount
 * </pre>
 */
public final class PriceFormatter {

    private static final String USD = "USD";

    private PriceFormatter() {
    }

    public static String format(@Nullable final BigDecimal amount, @Nullable final String currency) {
        return format(amount, currency, null);
    }

    /**
     * @param amount   numeric price
     * @param currency ISO currency code
     * @param flag     display label such as {@code Free} or {@code Announced}; wins when present
     * @return display price, never empty
     */
    public static String format(@Nullable final BigDecimal amount,
                                @Nullable final String currency,
                                @Nullable final String flag) {
        if (StringUtils.isNotBlank(flag)) {
            return flag.trim();
        }
        if (amount == null || StringUtils.isBlank(currency)) {
            return CanonicalRecord.UNAVAILABLE;
        }
        String code = currency.trim().toUpperCase(Locale.ROOT);
        String value = amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return USD.equals(code) ? "$" + value : code + " " + value;
    }
}
