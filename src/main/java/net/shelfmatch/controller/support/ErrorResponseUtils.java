package net.shelfmatch.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Builds the {@code {"error": "..."}} payloads returned by the recommendation endpoints.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }

    public static ResponseEntity<Object> error(HttpStatus status, Object body) {
        return ResponseEntity.status(status).body(body);
    }

    public static ResponseEntity<Object> badRequest(String message) {
        return error(HttpStatus.BAD_REQUEST, errorBody(message));
    }

    public static ResponseEntity<Object> serviceUnavailable(String message) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, errorBody(message));
    }

    public static ResponseEntity<Object> internalServerError(String message) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, errorBody(message));
    }
}
