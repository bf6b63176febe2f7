package com.jay.dealintel.model.enums;

public enum SynergyType {
    REVENUE,
    COST,
    TAX,
    FINANCIAL,
    OPERATIONAL
}
