package com.mar.simulator.domain.model;

public record JobResponse(String jobId) {}
