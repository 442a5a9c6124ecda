package com.currencyconverter.rates;

import com.currencyconverter.currency.Currency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for exchange rates.
 */
@Repository
public interface ExchangeRateRepository extends JpaRepository<ExchangeRate, Long> {

    @Query("SELECT r FROM ExchangeRate r WHERE r.currency.code = :code " +
           "AND r.validFrom <= :now AND r.validTo >= :now ORDER BY r.validFrom DESC")
    List<ExchangeRate> findValidRates(@Param("code") String code, @Param("now") LocalDateTime now);

    /**
     * The rate for a currency valid at the given moment. If windows overlap the
     * one that started most recently wins.
     */
    default Optional<ExchangeRate> findCurrentRate(String code, LocalDateTime now) {
        return findValidRates(code, now).stream().findFirst();
    }

    @Query("SELECT r FROM ExchangeRate r JOIN FETCH r.currency c " +
           "WHERE r.validFrom <= :now AND r.validTo >= :now ORDER BY c.code, r.validFrom DESC")
    List<ExchangeRate> findAllCurrent(@Param("now") LocalDateTime now);

    /**
     * Rates of a currency whose window intersects [from, to].
     */
    @Query("SELECT r FROM ExchangeRate r WHERE r.currency = :currency " +
           "AND r.validFrom <= :to AND r.validTo >= :from")
    List<ExchangeRate> findOverlappingRates(@Param("currency") Currency currency,
                                            @Param("from") LocalDateTime from,
                                            @Param("to") LocalDateTime to);

    /**
     * Rates of a currency whose window lies entirely inside [from, to].
     */
    @Query("SELECT r FROM ExchangeRate r WHERE r.currency = :currency " +
           "AND r.validFrom >= :from AND r.validTo <= :to ORDER BY r.validFrom ASC")
    List<ExchangeRate> findRatesInDateRange(@Param("currency") Currency currency,
                                            @Param("from") LocalDateTime from,
                                            @Param("to") LocalDateTime to);
}
