package com.travelrevenue.exception;

public class UnitNotFoundException extends RevenueEngineException {
    public UnitNotFoundException(Long id) {
        super("UNIT_NOT_FOUND", "Inventory unit with id '" + id + "' not found.");
    }
}
