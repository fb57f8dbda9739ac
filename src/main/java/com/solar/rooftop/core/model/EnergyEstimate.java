package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 发电量估算，完全由板数与配置决定
 */
@Value
@Builder
@Jacksonized
public class EnergyEstimate {
    @JsonProperty("system_capacity_kw")
    double systemCapacityKw;

    @JsonProperty("total_panel_area_m2")
    double totalPanelAreaM2;

    @JsonProperty("estimated_annual_kwh")
    double estimatedAnnualKwh;

    @JsonProperty("estimated_monthly_kwh")
    double estimatedMonthlyKwh;

    @JsonProperty("estimated_daily_kwh")
    double estimatedDailyKwh;

    @JsonProperty("co2_offset_kg_year")
    double co2OffsetKgYear;
}
