package com.phillippitts.coordination.presentation.dto;

public record TimeoutRequest(String message) {
}
