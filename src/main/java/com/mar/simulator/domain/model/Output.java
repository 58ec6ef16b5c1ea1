package com.mar.simulator.domain.model;

import lombok.Data;

@Data
public class Output {
    private boolean enabled = true;
    private String directory = "out";
}
