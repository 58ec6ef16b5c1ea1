package com.mar.simulator.config;

import jakarta.validation.Valid;
import lombok.Data;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;
import com.mar.simulator.domain.model.Costs;
import com.mar.simulator.domain.model.Entry;
import com.mar.simulator.domain.model.Exit;
import com.mar.simulator.domain.model.Macd;
import com.mar.simulator.domain.model.Output;
import com.mar.simulator.domain.model.PriceData;
import com.mar.simulator.domain.model.Pyramiding;
import com.mar.simulator.domain.model.SecurityOverrides;
import com.mar.simulator.domain.model.Sizing;
import com.mar.simulator.domain.model.Stops;

@Data
@Validated
@ConfigurationProperties(prefix = "simulator")
public class AppProperties {

    @Valid
    @NestedConfigurationProperty
    private Entry entry = new Entry();

    @Valid
    @NestedConfigurationProperty
    private Exit exit = new Exit();

    @Valid
    @NestedConfigurationProperty
    private Pyramiding pyramiding = new Pyramiding();

    @Valid
    @NestedConfigurationProperty
    private Stops stops = new Stops();

    @Valid
    @NestedConfigurationProperty
    private Sizing sizing = new Sizing();

    @Valid
    @NestedConfigurationProperty
    private Costs costs = new Costs();

    @Valid
    @NestedConfigurationProperty
    private Macd macd = new Macd();

    @Valid
    @NestedConfigurationProperty
    private PriceData data = new PriceData();

    @NestedConfigurationProperty
    private Output output = new Output();

    // keyed by security name
    private Map<String, @Valid SecurityOverrides> securities = new LinkedHashMap<>();
}
