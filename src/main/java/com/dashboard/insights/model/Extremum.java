package com.dashboard.insights.model;

public record Extremum(int index, double value, double prominence) {
}
