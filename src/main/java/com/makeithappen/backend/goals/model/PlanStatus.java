package com.makeithappen.backend.goals.model;

public enum PlanStatus { ACTIVE, ARCHIVED }
