package com.mar.simulator.domain.model;

import jakarta.validation.constraints.Min;
import lombok.Data;
import java.util.ArrayList;
import java.util.List;

@Data
public class PriceData {
    // one CSV per security, "time,price"
    private List<String> files = new ArrayList<>();

    // keep only the longest run of ticks spaced exactly this far apart; 0 keeps everything
    @Min(0) private long continuousIntervalSeconds = 1;
}
