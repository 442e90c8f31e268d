package com.good4it.lendingservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmiForgivenessWindow {

    @Column(name = "forgiven_emis")
    private Integer forgivenEmis;

    @Column(name = "start_month", length = 7)
    private String startMonth;

    @Column(name = "end_month", length = 7)
    private String endMonth;

    public boolean covers(YearMonth month) {
        if (startMonth == null || endMonth == null) {
            return false;
        }
        return !month.isBefore(YearMonth.parse(startMonth)) && !month.isAfter(YearMonth.parse(endMonth));
    }
}
