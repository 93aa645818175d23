package natter.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import natter.core.service.chat.ConnectionRegistry;

/**
 * Liveness acknowledgment and connection count.
 */
@Path("/api/v1/status")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    static final String STATUS_MESSAGE = "Good Day! Everything is up and running :)";

    private final ConnectionRegistry registry;

    @Inject
    public StatusResource(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @GET
    public Map<String, String> status() {
        return Map.of("message", STATUS_MESSAGE);
    }

    /**
     * Number of chat connections admitted on this instance.
     */
    @GET
    @Path("/connections")
    public Map<String, Integer> connections() {
        return Map.of("active", registry.size());
    }
}
