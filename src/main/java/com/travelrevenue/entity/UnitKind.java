package com.travelrevenue.entity;

public enum UnitKind {
    HOTEL,
    FLIGHT
}
