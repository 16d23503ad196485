package com.dashboard.insights.model;

public enum DecompositionModel {
    ADDITIVE,
    MULTIPLICATIVE
}
