package com.example.autoschedule.task;

public enum EnergyLevel {
    LOW,
    MEDIUM,
    HIGH
}
