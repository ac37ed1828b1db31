package com.phillippitts.coordination.presentation.dto;

/**
 * @param errorMessage optional failure description; ignored by learning
 */
public record CompleteRequest(boolean success, String errorMessage) {
}
