package natter.core.service.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import natter.core.model.chat.IdentityResolution;
import natter.core.model.common.UpstreamUnavailableException;
import natter.core.port.out.SessionStore;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdentityResolver")
class IdentityResolverTest {

    @Mock
    private SessionStore sessionStore;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(sessionStore);
    }

    @Nested
    @DisplayName("Valid tokens")
    class ValidTokenTests {

        @Test
        @DisplayName("Should resolve user ID and display name")
        void shouldResolveUserIdAndDisplayName() {
            when(sessionStore.findUserId("tok")).thenReturn(Uni.createFrom().item(Optional.of("u1")));
            when(sessionStore.findDisplayName("u1")).thenReturn(Uni.createFrom().item(Optional.of("alice")));

            var result = resolver.resolve(Optional.of("tok")).await().indefinitely();

            var resolved = assertInstanceOf(IdentityResolution.Resolved.class, result);
            assertEquals("u1", resolved.identity().userId());
            assertEquals("alice", resolved.identity().displayName());
        }

        @Test
        @DisplayName("Should fall back to the user ID when no display name is stored")
        void shouldFallBackToUserId() {
            when(sessionStore.findUserId("tok")).thenReturn(Uni.createFrom().item(Optional.of("u1")));
            when(sessionStore.findDisplayName("u1")).thenReturn(Uni.createFrom().item(Optional.empty()));

            var result = resolver.resolve(Optional.of("tok")).await().indefinitely();

            var resolved = assertInstanceOf(IdentityResolution.Resolved.class, result);
            assertEquals("u1", resolved.identity().displayName());
        }
    }

    @Nested
    @DisplayName("Invalid tokens")
    class InvalidTokenTests {

        @Test
        @DisplayName("Should be unauthenticated when no token is presented")
        void shouldBeUnauthenticatedWithoutToken() {
            var result = resolver.resolve(Optional.empty()).await().indefinitely();

            assertInstanceOf(IdentityResolution.Unauthenticated.class, result);
            verifyNoInteractions(sessionStore);
        }

        @Test
        @DisplayName("Should be unauthenticated for a blank token")
        void shouldBeUnauthenticatedForBlankToken() {
            var result = resolver.resolve(Optional.of("  ")).await().indefinitely();

            assertInstanceOf(IdentityResolution.Unauthenticated.class, result);
            verifyNoInteractions(sessionStore);
        }

        @Test
        @DisplayName("Should be unauthenticated for an unknown or expired token")
        void shouldBeUnauthenticatedForUnknownToken() {
            when(sessionStore.findUserId("expired")).thenReturn(Uni.createFrom().item(Optional.empty()));

            var result = resolver.resolve(Optional.of("expired")).await().indefinitely();

            var unauthenticated = assertInstanceOf(IdentityResolution.Unauthenticated.class, result);
            assertEquals("Invalid or expired session", unauthenticated.reason());
            verify(sessionStore, never()).findDisplayName(any());
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("Should be unavailable when the session lookup fails")
        void shouldBeUnavailableWhenLookupFails() {
            when(sessionStore.findUserId("tok"))
                    .thenReturn(Uni.createFrom().failure(new UpstreamUnavailableException("Redis down")));

            var result = resolver.resolve(Optional.of("tok")).await().indefinitely();

            assertInstanceOf(IdentityResolution.Unavailable.class, result);
        }

        @Test
        @DisplayName("Should be unavailable when the display name lookup fails")
        void shouldBeUnavailableWhenDisplayNameLookupFails() {
            when(sessionStore.findUserId("tok")).thenReturn(Uni.createFrom().item(Optional.of("u1")));
            when(sessionStore.findDisplayName("u1"))
                    .thenReturn(Uni.createFrom().failure(new UpstreamUnavailableException("Redis down")));

            var result = resolver.resolve(Optional.of("tok")).await().indefinitely();

            assertInstanceOf(IdentityResolution.Unavailable.class, result);
        }
    }
}
