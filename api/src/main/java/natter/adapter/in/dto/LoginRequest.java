package natter.adapter.in.dto;

/**
 * DTO for login requests.
 *
 * @param email    login email
 * @param password plaintext password
 */
public record LoginRequest(String email, String password) {}
