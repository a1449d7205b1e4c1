package com.mylab.labservice.api.dto;

public record CompleteRequest(String resultSummary) {
}
