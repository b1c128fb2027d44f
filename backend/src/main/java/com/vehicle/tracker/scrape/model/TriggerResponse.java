package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(boolean success, String message, String error) {

    public static TriggerResponse accepted(String message) {
        return new TriggerResponse(true, message, null);
    }

    public static TriggerResponse rejected(String error) {
        return new TriggerResponse(false, null, error);
    }
}
