package com.makeithappen.backend.daily.web;

public class ActionNotFoundException extends RuntimeException {

    private final String actionId;

    public ActionNotFoundException(String actionId) {
        super("ACTION_NOT_FOUND");
        this.actionId = actionId;
    }

    public String actionId() { return actionId; }
}
