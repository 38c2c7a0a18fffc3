package com.kmg.dms.dto;

public record TriggerScanResponse(boolean accepted, String message) {
}
