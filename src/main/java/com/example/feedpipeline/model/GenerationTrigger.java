package com.example.feedpipeline.model;

public enum GenerationTrigger {
    SCHEDULED,
    MANUAL
}
