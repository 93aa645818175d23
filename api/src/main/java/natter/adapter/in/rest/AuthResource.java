package natter.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import natter.adapter.in.dto.LoginRequest;
import natter.adapter.in.dto.RegisterRequest;
import natter.adapter.in.problem.ChatProblem;
import natter.core.config.SessionConfig;
import natter.core.port.in.AccountManagement;

/**
 * REST resource for account registration and session tokens.
 *
 * <p>The session token returned by login is what a client presents when opening
 * the chat WebSocket.
 */
@Path("/api/v1/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private final AccountManagement accountService;
    private final SessionConfig sessionConfig;

    @Inject
    public AuthResource(AccountManagement accountService, SessionConfig sessionConfig) {
        this.accountService = accountService;
        this.sessionConfig = sessionConfig;
    }

    @POST
    @Path("/register")
    public Uni<Map<String, Object>> register(RegisterRequest request) {
        if (request == null) {
            throw ChatProblem.badRequest("Request body is required");
        }

        return accountService
                .register(request.email(), request.password(), Optional.ofNullable(request.displayName()))
                .map(account -> {
                    var body = new LinkedHashMap<String, Object>();
                    body.put("message", "User created");
                    body.put("uid", account.uid());
                    return body;
                });
    }

    @POST
    @Path("/login")
    public Uni<Map<String, Object>> login(LoginRequest request) {
        if (request == null) {
            throw ChatProblem.badRequest("Request body is required");
        }

        return accountService.login(request.email(), request.password()).map(grant -> {
            var body = new LinkedHashMap<String, Object>();
            body.put("session_token", grant.token());
            body.put("expires_at", grant.expiresAt().toString());
            return body;
        });
    }

    /**
     * Invalidate a session token. Open chat connections using it are closed.
     *
     * <p>The token is read from the {@code session_token} query parameter, or from
     * the configured token header when the parameter is absent.
     */
    @POST
    @Path("/logout")
    public Uni<Map<String, Object>> logout(@QueryParam("session_token") String sessionToken, @Context HttpHeaders headers) {
        var token = sessionToken;
        if (token == null || token.isBlank()) {
            token = headers.getHeaderString(sessionConfig.tokenHeader());
        }
        if (token == null || token.isBlank()) {
            throw ChatProblem.badRequest("session_token is required");
        }

        return accountService.logout(token.trim()).map(ignored -> Map.<String, Object>of("message", "Logged out"));
    }
}
