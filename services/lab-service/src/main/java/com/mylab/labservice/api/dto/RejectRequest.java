package com.mylab.labservice.api.dto;

public record RejectRequest(String reason) {
}
