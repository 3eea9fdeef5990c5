package com.exchangesim.report;

public enum ReportFormat {
    TEXT,
    JSON
}
