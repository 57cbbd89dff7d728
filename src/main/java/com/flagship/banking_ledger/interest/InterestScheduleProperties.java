package com.flagship.banking_ledger.interest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cohorts posted by the monthly interest run, bound from {@code ledger.interest.schedules}.
 * The run's cron expression is read by the scheduler itself.
 */
@Validated
@ConfigurationProperties(prefix = "ledger.interest")
public record InterestScheduleProperties(
    @Valid List<Schedule> schedules
) {

    public InterestScheduleProperties {
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
    }

    public record Schedule(
        @NotBlank String accountTypeCode,
        @NotNull @DecimalMin("0.0") BigDecimal annualRatePercent
    ) {
    }
}
