package com.example.footprint.model;

public enum AllocationMethod {
    MASS,
    ECONOMIC,
    VOLUME
}
