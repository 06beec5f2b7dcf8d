package com.cloudwise.costanalytics.controller.dto;

public record ConfidenceBandDto(Double lower, Double upper) {
}
