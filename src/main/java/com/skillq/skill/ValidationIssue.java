package com.skillq.skill;

public record ValidationIssue(String field, String message, String code) {
}
