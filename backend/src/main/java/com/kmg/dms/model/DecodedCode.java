package com.kmg.dms.model;

public record DecodedCode(int page, String raw) {
}
