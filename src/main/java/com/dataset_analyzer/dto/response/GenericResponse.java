package com.dataset_analyzer.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every API answer. {@code errorCode} is empty on success.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenericResponse<T> {
    private T dataHeader;
    private String errorCode;
    private String message;
    private Metadata metadata;

    public static <T> GenericResponse<T> success(String message, T dataHeader, Metadata metadata) {
        return GenericResponse.<T>builder()
                .message(message)
                .dataHeader(dataHeader)
                .metadata(metadata)
                .errorCode("")
                .build();
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message) {
        return GenericResponse.<T>builder()
                .errorCode(errorCode)
                .message(message)
                .metadata(new Metadata())
                .build();
    }
}
