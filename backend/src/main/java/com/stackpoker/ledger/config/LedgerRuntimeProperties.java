package com.stackpoker.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Session ledger defaults: money rounding, staking bounds, live session staleness
 * and the placeholder names shown while a staker identity cannot be resolved.
 *
 * <p>The scales and the markup floor are capped by the schema in
 * {@code V1__create_session_ledger.sql}: amounts are NUMERIC(18, 2), ratios NUMERIC(7, 4)
 * and NUMERIC(9, 4), and markup is checked to be at least 1. Binding fails for values the
 * columns could not store without rounding or rejecting them.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "stackpoker.ledger")
public class LedgerRuntimeProperties {

    @Valid
    private Money money = new Money();
    @Valid
    private Staking staking = new Staking();
    private Session session = new Session();
    private Display display = new Display();

    @Getter
    @Setter
    public static class Money {
        /**
         * Decimal places kept on stored amounts and settlement results. At most the
         * column scale of 2.
         */
        @Min(0)
        @Max(2)
        private int scale = 2;
    }

    @Getter
    @Setter
    public static class Staking {
        @NotNull
        @DecimalMin("1.0")
        private BigDecimal minimumMarkup = new BigDecimal("1.0");

        /**
         * Decimal places accepted on stake percentage and markup. At most the column
         * scale of 4.
         */
        @Min(0)
        @Max(4)
        private int ratioScale = 4;
    }

    @Getter
    @Setter
    public static class Session {
        /**
         * Live sessions with no activity for this long are reported as abandoned.
         */
        private int abandonedAfterHours = 48;
        private int maxNoteLength = 500;
    }

    @Getter
    @Setter
    public static class Display {
        private String appUserFallbackName = "Loading...";
        private String manualStakerFallbackName = "Manual Staker";
    }
}
