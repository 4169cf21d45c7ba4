package com.fvgscanner.domain.enums;

public enum PivotType {
    HIGH,
    LOW
}
