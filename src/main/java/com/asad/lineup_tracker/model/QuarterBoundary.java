package com.asad.lineup_tracker.model;

public record QuarterBoundary(int period, int firstActionNumber, int lastActionNumber) {}
