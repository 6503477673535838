package bastion.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.adapter.out.cache.CaffeineCacheBackend;
import bastion.adapter.out.storage.memory.InMemoryAccountStore;
import bastion.core.cache.CacheHandler;
import bastion.core.model.auth.AuthenticationException;
import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.FailureReason;
import bastion.core.model.auth.TotpSecret;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.spi.AccountStore;
import bastion.spi.SecurityEvent;
import bastion.spi.StoreUnavailableException;
import bastion.support.MutableClock;
import bastion.support.RecordingPublisher;
import bastion.support.TestConfigs;

@DisplayName("AccountStoreRealm")
class AccountStoreRealmTest {

    private static final String PASSWORD = "open sesame";

    private MutableClock clock;
    private RecordingPublisher events;
    private HashAlgorithmRegistry hashAlgorithms;
    private CacheHandler cache;
    private InMemoryAccountStore store;
    private AccountStoreRealm realm;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        events = new RecordingPublisher();
        hashAlgorithms = new HashAlgorithmRegistry(TestConfigs.authc(), Runnable::run);
        cache = new CacheHandler(new CaffeineCacheBackend(100), TestConfigs.cache(), clock);
        store = new InMemoryAccountStore();
        realm = realmOver(store);
    }

    private AccountStoreRealm realmOver(AccountStore accountStore) {
        return new AccountStoreRealm(
                "main",
                accountStore,
                new IndexedPermissionVerifier(),
                new SimpleRoleVerifier(),
                hashAlgorithms,
                cache,
                TestConfigs.store(3),
                events,
                clock);
    }

    private CredentialRecord hashed(String principal, String algorithm) {
        return hashAlgorithms.hash(principal, PASSWORD.toCharArray(), algorithm).await().indefinitely();
    }

    private static UsernamePasswordToken token(String principal, String password) {
        return new UsernamePasswordToken(principal, password.toCharArray());
    }

    private FailureReason failureOf(UsernamePasswordToken token) {
        return assertThrows(
                        AuthenticationException.class,
                        () -> realm.authenticate(token).await().indefinitely())
                .reason();
    }

    @Nested
    @DisplayName("authenticate()")
    class AuthenticateTests {

        @Test
        @DisplayName("should accept valid credentials")
        void shouldAcceptValidCredentials() {
            store.putAccount(hashed("alice", "argon2"), Set.of(), Set.of());

            final var account = realm.authenticate(token("alice", PASSWORD)).await().indefinitely();

            assertEquals("alice", account.principal());
            assertEquals("main", account.realmName());
            assertFalse(account.upgraded());
        }

        @Test
        @DisplayName("should reject a wrong password")
        void shouldRejectWrongPassword() {
            store.putAccount(hashed("alice", "argon2"), Set.of(), Set.of());

            assertEquals(FailureReason.INVALID_CREDENTIALS, failureOf(token("alice", "guess")));
        }

        @Test
        @DisplayName("should reject an unknown account with the same generic message")
        void shouldRejectUnknownAccount() {
            final var error = assertThrows(
                    AuthenticationException.class,
                    () -> realm.authenticate(token("nobody", PASSWORD)).await().indefinitely());

            assertEquals(FailureReason.UNKNOWN_ACCOUNT, error.reason());
            assertEquals(AuthenticationException.GENERIC_MESSAGE, error.getMessage());
        }

        @Test
        @DisplayName("should reject a credential stored with an unsupported algorithm")
        void shouldRejectUnsupportedAlgorithm() {
            store.putAccount(new CredentialRecord("alice", "md5", "abc", Map.of()), Set.of(), Set.of());

            assertEquals(FailureReason.UNVERIFIABLE_CREDENTIAL, failureOf(token("alice", PASSWORD)));
        }
    }

    @Nested
    @DisplayName("credential migration")
    class MigrationTests {

        @Test
        @DisplayName("should re-hash a legacy credential with the preferred algorithm on login")
        void shouldMigrateLegacyCredential() {
            store.putAccount(hashed("alice", "pbkdf2_sha256"), Set.of(), Set.of());

            final var account = realm.authenticate(token("alice", PASSWORD)).await().indefinitely();

            assertTrue(account.upgraded());
            final var stored = store.credentialOf("alice");
            assertEquals("argon2", stored.algorithmId());
            assertTrue(hashAlgorithms.verify(PASSWORD.toCharArray(), stored).await().indefinitely());
            final var upgrade = events.eventsOf(SecurityEvent.CredentialUpgraded.class).get(0);
            assertEquals("pbkdf2_sha256", upgrade.fromAlgorithm());
            assertEquals("argon2", upgrade.toAlgorithm());

            final var next = realm.authenticate(token("alice", PASSWORD)).await().indefinitely();
            assertFalse(next.upgraded());
        }

        @Test
        @DisplayName("should not touch the credential on a failed login")
        void shouldNotMigrateOnFailure() {
            final var legacy = hashed("alice", "bcrypt_sha256");
            store.putAccount(legacy, Set.of(), Set.of());

            failureOf(token("alice", "wrong"));

            assertEquals(legacy, store.credentialOf("alice"));
        }

        @Test
        @DisplayName("should still log in when writing the upgraded credential fails")
        void shouldLoginWhenUpgradeWriteFails() {
            final var accountStore = mock(AccountStore.class);
            when(accountStore.findCredential("alice"))
                    .thenReturn(Uni.createFrom().item(hashed("alice", "pbkdf2_sha256")));
            when(accountStore.updateCredential(any()))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("read-only replica")));

            final var account = realmOver(accountStore).authenticate(token("alice", PASSWORD)).await().indefinitely();

            assertFalse(account.upgraded());
            verify(accountStore, times(3)).updateCredential(any());
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("should retry a transiently unavailable store")
        void shouldRetryTransientFailure() {
            final var accountStore = mock(AccountStore.class);
            when(accountStore.findCredential("alice"))
                    .thenReturn(
                            Uni.createFrom().failure(new StoreUnavailableException("timeout")),
                            Uni.createFrom().item(hashed("alice", "argon2")));

            final var account = realmOver(accountStore).authenticate(token("alice", PASSWORD)).await().indefinitely();

            assertEquals("alice", account.principal());
            verify(accountStore, times(2)).findCredential("alice");
        }

        @Test
        @DisplayName("should give up after the configured attempts")
        void shouldGiveUpAfterMaxAttempts() {
            final var accountStore = mock(AccountStore.class);
            when(accountStore.findCredential("alice"))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("down")));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> realmOver(accountStore).authenticate(token("alice", PASSWORD)).await().indefinitely());
            verify(accountStore, times(3)).findCredential("alice");
        }

        @Test
        @DisplayName("should report unexpected store errors as unavailable")
        void shouldWrapUnexpectedErrors() {
            final var accountStore = mock(AccountStore.class);
            when(accountStore.findCredential("alice"))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("driver bug")));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> realmOver(accountStore).authenticate(token("alice", PASSWORD)).await().indefinitely());
            verify(accountStore, times(1)).findCredential("alice");
        }
    }

    @Nested
    @DisplayName("authorization")
    class AuthorizationTests {

        @BeforeEach
        void setUp() {
            store.putAccount(hashed("alice", "argon2"), Set.of("admin"), Set.of("printer:print:lp7200", "doc:*"));
        }

        @Test
        @DisplayName("should check roles and permissions")
        void shouldCheckRolesAndPermissions() {
            assertTrue(realm.hasRole("alice", "admin").await().indefinitely());
            assertFalse(realm.hasRole("alice", "auditor").await().indefinitely());
            assertTrue(realm.isPermitted("alice", "printer:print:lp7200").await().indefinitely());
            assertTrue(realm.isPermitted("alice", "doc:delete:42").await().indefinitely());
            assertFalse(realm.isPermitted("alice", "printer:query:lp7200").await().indefinitely());
        }

        @Test
        @DisplayName("should deny everything to unknown principals")
        void shouldDenyUnknownPrincipal() {
            assertFalse(realm.hasRole("mallory", "admin").await().indefinitely());
            assertFalse(realm.isPermitted("mallory", "doc:read").await().indefinitely());
        }

        @Test
        @DisplayName("should serve cached grants until cleared")
        void shouldServeCachedGrantsUntilCleared() {
            assertTrue(realm.hasRole("alice", "admin").await().indefinitely());

            store.putAuthorizationInfo("alice", Set.of(), Set.of());
            assertTrue(realm.hasRole("alice", "admin").await().indefinitely());

            realm.clearCachedInfo("alice").await().indefinitely();
            assertFalse(realm.hasRole("alice", "admin").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("one-time code secrets")
    class TotpSecretTests {

        @Test
        @DisplayName("should read secrets once and reread them after a save")
        void shouldCacheSecretsUntilSaved() {
            store.putAccount(hashed("alice", "argon2"), Set.of(), Set.of());
            final var counting = spy(store);
            final var caching = realmOver(counting);

            assertTrue(caching.findTotpSecrets("alice").await().indefinitely().isEmpty());
            assertTrue(caching.findTotpSecrets("alice").await().indefinitely().isEmpty());
            verify(counting, times(1)).findTotpSecrets("alice");

            final var secret = new TotpSecret("alice", "2024", "wrapped-secret", 4);
            caching.saveTotpSecret(secret).await().indefinitely();

            assertEquals(List.of(secret), caching.findTotpSecrets("alice").await().indefinitely());
            verify(counting, times(2)).findTotpSecrets("alice");
        }

        @Test
        @DisplayName("should drop cached secrets with the rest of the account data")
        void shouldClearCachedSecrets() {
            store.putAccount(hashed("alice", "argon2"), Set.of(), Set.of());
            final var counting = spy(store);
            final var caching = realmOver(counting);

            caching.findTotpSecrets("alice").await().indefinitely();
            caching.clearCachedInfo("alice").await().indefinitely();
            caching.findTotpSecrets("alice").await().indefinitely();

            verify(counting, times(2)).findTotpSecrets("alice");
        }
    }
}
