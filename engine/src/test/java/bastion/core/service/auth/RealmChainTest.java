package bastion.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import bastion.core.model.auth.AuthenticatedAccount;
import bastion.core.model.auth.AuthenticationException;
import bastion.core.model.auth.FailureReason;
import bastion.core.model.auth.TotpSecret;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.spi.AccountNotFoundException;
import bastion.spi.StoreUnavailableException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RealmChain")
class RealmChainTest {

    @Mock
    private Realm first;

    @Mock
    private Realm second;

    private RealmChain chain;
    private UsernamePasswordToken token;

    @BeforeEach
    void setUp() {
        when(first.name()).thenReturn("first");
        when(second.name()).thenReturn("second");
        chain = new RealmChain(List.of(first, second));
        token = new UsernamePasswordToken("alice", "pw".toCharArray());
    }

    private static Uni<AuthenticatedAccount> rejected(FailureReason reason) {
        return Uni.createFrom().failure(new AuthenticationException("alice", reason));
    }

    @Nested
    @DisplayName("authenticate()")
    class AuthenticateTests {

        @Test
        @DisplayName("should fall through to the next realm")
        void shouldFallThrough() {
            when(first.authenticate(token)).thenReturn(rejected(FailureReason.UNKNOWN_ACCOUNT));
            when(second.authenticate(token))
                    .thenReturn(Uni.createFrom().item(new AuthenticatedAccount("alice", "second", false)));

            final var account = chain.authenticate(token).await().indefinitely();

            assertEquals("second", account.realmName());
        }

        @Test
        @DisplayName("should stop at the first realm that accepts")
        void shouldStopAtFirstSuccess() {
            when(first.authenticate(token))
                    .thenReturn(Uni.createFrom().item(new AuthenticatedAccount("alice", "first", false)));

            chain.authenticate(token).await().indefinitely();

            verify(second, never()).authenticate(any());
        }

        @Test
        @DisplayName("should report the most specific reason when every realm rejects")
        void shouldReportMostSpecificReason() {
            when(first.authenticate(token)).thenReturn(rejected(FailureReason.INVALID_CREDENTIALS));
            when(second.authenticate(token)).thenReturn(rejected(FailureReason.UNKNOWN_ACCOUNT));

            final var error = assertThrows(
                    AuthenticationException.class,
                    () -> chain.authenticate(token).await().indefinitely());

            assertEquals(FailureReason.INVALID_CREDENTIALS, error.reason());
            assertEquals("alice", error.principal());
        }

        @Test
        @DisplayName("should propagate a store outage without trying further realms")
        void shouldPropagateStoreOutage() {
            when(first.authenticate(token))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("down")));

            assertThrows(StoreUnavailableException.class, () -> chain.authenticate(token).await().indefinitely());
            verify(second, never()).authenticate(any());
        }
    }

    @Nested
    @DisplayName("authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("should grant a permission any realm grants")
        void shouldGrantWhenAnyRealmGrants() {
            when(first.isPermitted("alice", "doc:read")).thenReturn(Uni.createFrom().item(false));
            when(second.isPermitted("alice", "doc:read")).thenReturn(Uni.createFrom().item(true));

            assertTrue(chain.isPermitted("alice", "doc:read").await().indefinitely());
        }

        @Test
        @DisplayName("should deny a role no realm grants")
        void shouldDenyWhenNoRealmGrants() {
            when(first.hasRole(anyString(), anyString())).thenReturn(Uni.createFrom().item(false));
            when(second.hasRole(anyString(), anyString())).thenReturn(Uni.createFrom().item(false));

            assertFalse(chain.hasRole("alice", "admin").await().indefinitely());
        }

        @Test
        @DisplayName("should require every permission for isPermittedAll")
        void shouldRequireEveryPermission() {
            when(first.isPermitted("alice", "doc:read")).thenReturn(Uni.createFrom().item(true));
            when(first.isPermitted("alice", "doc:write")).thenReturn(Uni.createFrom().item(false));
            when(second.isPermitted(anyString(), anyString())).thenReturn(Uni.createFrom().item(false));

            assertTrue(chain.isPermittedAll("alice", List.of("doc:read")).await().indefinitely());
            assertFalse(chain.isPermittedAll("alice", List.of("doc:read", "doc:write")).await().indefinitely());
            assertTrue(chain.isPermittedAll("alice", List.of()).await().indefinitely());
        }

        @Test
        @DisplayName("should combine roles across realms for hasAllRoles")
        void shouldCombineRolesAcrossRealms() {
            when(first.hasRole("alice", "admin")).thenReturn(Uni.createFrom().item(true));
            when(first.hasRole("alice", "auditor")).thenReturn(Uni.createFrom().item(false));
            when(second.hasRole("alice", "auditor")).thenReturn(Uni.createFrom().item(true));
            when(second.hasRole("alice", "admin")).thenReturn(Uni.createFrom().item(false));

            assertTrue(chain.hasAllRoles("alice", Set.of("admin", "auditor")).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("TOTP secrets")
    class TotpSecretTests {

        @Test
        @DisplayName("should collect secrets from every realm")
        void shouldCollectSecrets() {
            final var a = new TotpSecret("alice", "2023", "x", 4);
            final var b = new TotpSecret("alice", "2024", "y", 4);
            when(first.findTotpSecrets("alice")).thenReturn(Uni.createFrom().item(List.of(a)));
            when(second.findTotpSecrets("alice")).thenReturn(Uni.createFrom().item(List.of(b)));

            assertEquals(List.of(a, b), chain.findTotpSecrets("alice").await().indefinitely());
        }

        @Test
        @DisplayName("should save into the first realm that knows the principal")
        void shouldSaveIntoOwningRealm() {
            final var secret = new TotpSecret("alice", "2024", "x", 4);
            when(first.saveTotpSecret(secret))
                    .thenReturn(Uni.createFrom().failure(new AccountNotFoundException("alice")));
            when(second.saveTotpSecret(secret)).thenReturn(Uni.createFrom().voidItem());

            chain.saveTotpSecret(secret).await().indefinitely();

            verify(second).saveTotpSecret(secret);
        }

        @Test
        @DisplayName("should fail when no realm knows the principal")
        void shouldFailForUnknownPrincipal() {
            final var secret = new TotpSecret("ghost", "2024", "x", 4);
            when(first.saveTotpSecret(secret))
                    .thenReturn(Uni.createFrom().failure(new AccountNotFoundException("ghost")));
            when(second.saveTotpSecret(secret))
                    .thenReturn(Uni.createFrom().failure(new AccountNotFoundException("ghost")));

            assertThrows(AccountNotFoundException.class, () -> chain.saveTotpSecret(secret).await().indefinitely());
        }
    }

    @Test
    @DisplayName("should require at least one realm")
    void shouldRequireRealms() {
        assertThrows(IllegalArgumentException.class, () -> new RealmChain(List.of()));
    }
}
