package natter.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for account registration requests.
 *
 * @param email       login email (required)
 * @param password    plaintext password (required)
 * @param displayName name shown in front of chat messages; defaults to the user ID
 */
public record RegisterRequest(String email, String password, @JsonProperty("display_name") String displayName) {}
