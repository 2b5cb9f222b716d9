package com.travelrevenue.dto;

public enum AlertLevel {
    DANGER,
    WARNING,
    INFO
}
