package natter.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import natter.core.model.common.UpstreamUnavailableException;
import natter.core.port.in.AccountManagement.AccountExistsException;
import natter.core.port.in.AccountManagement.InvalidCredentialsException;
import natter.core.port.in.AccountManagement.SessionCreationException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ChatProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapAccountExistsException(AccountExistsException e) {
        LOG.debugv("Registration conflict: {0}", e.getMessage());
        return toResponse(ChatProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapInvalidCredentialsException(InvalidCredentialsException e) {
        return toResponse(ChatProblem.unauthorized(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamUnavailableException(UpstreamUnavailableException e) {
        LOG.warnv("Upstream unavailable: {0}", e.getMessage());
        return toResponse(ChatProblem.serviceUnavailable("Session storage unavailable"));
    }

    @ServerExceptionMapper
    public Response mapSessionCreationException(SessionCreationException e) {
        LOG.warnv("Session creation failed: {0}", e.getMessage());
        return toResponse(ChatProblem.serviceUnavailable(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
