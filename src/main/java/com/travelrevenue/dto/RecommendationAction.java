package com.travelrevenue.dto;

public enum RecommendationAction {
    BUNDLE,
    STANDALONE
}
