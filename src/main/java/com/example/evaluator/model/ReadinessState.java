package com.example.evaluator.model;

public enum ReadinessState {
    READY,
    MISSING_INFO,
    WAITING
}
