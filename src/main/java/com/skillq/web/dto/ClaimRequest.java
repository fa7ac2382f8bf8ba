package com.skillq.web.dto;

public record ClaimRequest(String workerId) {
}
