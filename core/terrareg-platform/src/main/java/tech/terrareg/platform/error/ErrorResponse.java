package tech.terrareg.platform.error;

import java.util.List;

/**
 * Wire body for every error: {@code {"errors":[...]}}.
 */
public record ErrorResponse(List<String> errors) {

    public static ErrorResponse of(String... messages) {
        return new ErrorResponse(List.of(messages));
    }
}
