package com.travelrevenue.dto;

public enum PaceSource {
    RECENT_ACTIVITY,
    THEORETICAL
}
