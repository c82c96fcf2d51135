package com.example.feedpipeline.model;

public enum Frequency {
    MANUAL,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY
}
