package natter.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for chat gateway errors.
 */
public final class ChatProblem {

    private ChatProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Authentication Errors ==========

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }
}
