package latch.core.model.principal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import latch.adapter.out.credential.memory.InMemoryCredentialVerifier;
import latch.spi.CredentialBackendException;
import latch.spi.CredentialVerifier;

@DisplayName("AdminPrincipal")
class AdminPrincipalTest {

    private InMemoryCredentialVerifier verifier;
    private AdminPrincipal admin;

    @BeforeEach
    void setUp() {
        verifier = new InMemoryCredentialVerifier();
        verifier.register("admin1", "p@ss");
        admin = new AdminPrincipal("admin1", 7, verifier);
    }

    @Nested
    @DisplayName("identity")
    class IdentityTests {

        @Test
        @DisplayName("should expose username, id and ADMIN role")
        void shouldExposeIdentity() {
            assertEquals("admin1", admin.username());
            assertEquals(7, admin.id());
            assertEquals("ADMIN", admin.role());
        }

        @Test
        @DisplayName("should reject blank username")
        void shouldRejectBlankUsername() {
            assertThrows(IllegalArgumentException.class, () -> new AdminPrincipal(" ", 1, verifier));
        }

        @Test
        @DisplayName("should require a credential verifier")
        void shouldRequireVerifier() {
            assertThrows(NullPointerException.class, () -> new AdminPrincipal("admin1", 1, null));
        }
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should accept valid credentials")
        void shouldAcceptValidCredentials() {
            assertTrue(admin.authenticate("admin1", "p@ss"));
            assertTrue(admin.isAuthenticated());
            assertTrue(admin.authenticatedAt().isPresent());
        }

        @Test
        @DisplayName("should reject wrong password")
        void shouldRejectWrongPassword() {
            assertFalse(admin.authenticate("admin1", "wrong"));
            assertFalse(admin.isAuthenticated());
            assertEquals(1, admin.consecutiveFailures());
        }

        @Test
        @DisplayName("should reject a username that is not the principal's")
        void shouldRejectForeignUsername() {
            verifier.register("other", "p@ss");

            assertFalse(admin.authenticate("other", "p@ss"));
        }

        @Test
        @DisplayName("should reject null password without consulting the backend")
        void shouldRejectNullPassword() {
            var backend = mock(CredentialVerifier.class);
            var principal = new AdminPrincipal("admin1", 7, backend);

            assertFalse(principal.authenticate("admin1", null));
            verify(backend, never()).verify(anyString(), anyString());
        }

        @Test
        @DisplayName("should clear authenticated state after a failed attempt")
        void shouldClearStateAfterFailure() {
            admin.authenticate("admin1", "p@ss");

            admin.authenticate("admin1", "wrong");

            assertFalse(admin.isAuthenticated());
        }

        @Test
        @DisplayName("should propagate backend failure without counting it")
        void shouldPropagateBackendFailure() {
            var backend = mock(CredentialVerifier.class);
            when(backend.verify("admin1", "p@ss")).thenThrow(new CredentialBackendException("backend down"));
            var principal = new AdminPrincipal("admin1", 7, backend, LockoutPolicy.afterFailures(1));

            assertThrows(CredentialBackendException.class, () -> principal.authenticate("admin1", "p@ss"));
            assertEquals(0, principal.consecutiveFailures());
            assertFalse(principal.isLockedOut());
        }
    }

    @Nested
    @DisplayName("lockout")
    class LockoutTests {

        private AdminPrincipal guarded;

        @BeforeEach
        void setUp() {
            guarded = new AdminPrincipal("admin1", 7, verifier, LockoutPolicy.afterFailures(3));
        }

        @Test
        @DisplayName("should lock out after the configured number of failures")
        void shouldLockOutAfterFailures() {
            guarded.authenticate("admin1", "a");
            guarded.authenticate("admin1", "b");
            guarded.authenticate("admin1", "c");

            assertTrue(guarded.isLockedOut());
            assertFalse(guarded.authenticate("admin1", "p@ss"));
        }

        @Test
        @DisplayName("should reset failure count on success")
        void shouldResetOnSuccess() {
            guarded.authenticate("admin1", "a");
            guarded.authenticate("admin1", "b");

            assertTrue(guarded.authenticate("admin1", "p@ss"));
            assertEquals(0, guarded.consecutiveFailures());
        }

        @Test
        @DisplayName("should accept valid credentials after lockout reset")
        void shouldAcceptAfterReset() {
            guarded.authenticate("admin1", "a");
            guarded.authenticate("admin1", "b");
            guarded.authenticate("admin1", "c");

            guarded.resetLockout();

            assertFalse(guarded.isLockedOut());
            assertTrue(guarded.authenticate("admin1", "p@ss"));
        }

        @Test
        @DisplayName("should never lock out when disabled")
        void shouldNeverLockOutWhenDisabled() {
            for (int i = 0; i < 20; i++) {
                admin.authenticate("admin1", "wrong");
            }

            assertFalse(admin.isLockedOut());
            assertTrue(admin.authenticate("admin1", "p@ss"));
        }
    }

    @Nested
    @DisplayName("logout")
    class LogoutTests {

        @Test
        @DisplayName("should clear authenticated state")
        void shouldClearAuthenticatedState() {
            admin.authenticate("admin1", "p@ss");

            admin.logout();

            assertFalse(admin.isAuthenticated());
            assertTrue(admin.authenticatedAt().isEmpty());
        }

        @Test
        @DisplayName("should be a no-op when already logged out")
        void shouldBeIdempotent() {
            admin.logout();
            admin.logout();

            assertFalse(admin.isAuthenticated());
        }
    }

    @Nested
    @DisplayName("permissions")
    class PermissionTests {

        @Test
        @DisplayName("should append permission at the end")
        void shouldAppendAtEnd() {
            admin.addPermission("sessions.read");
            admin.addPermission("x");

            var permissions = admin.permissions();
            assertEquals(List.of("sessions.read", "x"), permissions);
            assertEquals(1, permissions.stream().filter("x"::equals).count());
        }

        @Test
        @DisplayName("should keep duplicates in insertion order")
        void shouldKeepDuplicates() {
            admin.addPermission("a");
            admin.addPermission("b");
            admin.addPermission("a");

            assertEquals(List.of("a", "b", "a"), admin.permissions());
        }

        @Test
        @DisplayName("should return an immutable snapshot")
        void shouldReturnSnapshot() {
            admin.addPermission("a");
            var snapshot = admin.permissions();

            admin.addPermission("b");

            assertEquals(List.of("a"), snapshot);
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add("c"));
        }

        @Test
        @DisplayName("should reject blank permission")
        void shouldRejectBlankPermission() {
            assertThrows(IllegalArgumentException.class, () -> admin.addPermission(""));
            assertThrows(IllegalArgumentException.class, () -> admin.addPermission(null));
        }

        @Test
        @DisplayName("should grant everything through the wildcard")
        void shouldGrantThroughWildcard() {
            assertFalse(admin.hasPermission("sessions.revoke"));

            admin.addPermission(PermissionHolder.ALL);

            assertTrue(admin.hasPermission("sessions.revoke"));
        }

        @Test
        @DisplayName("should never grant a null permission")
        void shouldNeverGrantNullPermission() {
            admin.addPermission("sessions.read");
            assertFalse(admin.hasPermission(null));

            admin.addPermission(PermissionHolder.ALL);
            assertFalse(admin.hasPermission(null));
        }

        @Test
        @DisplayName("should not lose appends from concurrent threads")
        void shouldNotLoseConcurrentAppends() throws InterruptedException {
            int threads = 16;
            int perThread = 250;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    final int thread = t;
                    executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            admin.addPermission("perm-" + thread + "-" + i);
                        }
                        return null;
                    });
                }
                start.countDown();
            } finally {
                executor.shutdown();
            }

            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, admin.permissions().size());
        }
    }
}
