package bastion.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bastion.adapter.out.storage.memory.InMemoryAccountStoreProvider;
import bastion.core.cache.CacheHandler;
import bastion.core.config.SecurityManagerConfig.RealmConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.spi.AccountStoreProvider;
import bastion.spi.CacheBackend;
import bastion.support.RecordingPublisher;
import bastion.support.TestConfigs;

@DisplayName("RealmRegistry")
class RealmRegistryTest {

    private HashAlgorithmRegistry hashAlgorithms;
    private CacheHandler cache;

    @BeforeEach
    void setUp() {
        hashAlgorithms = new HashAlgorithmRegistry(TestConfigs.authc(), Runnable::run);
        cache = new CacheHandler((CacheBackend) null, TestConfigs.cacheDisabled(), Clock.systemUTC());
    }

    private RealmRegistry registry(List<? extends RealmConfig> realms) {
        return new RealmRegistry(
                realms,
                () -> Stream.<AccountStoreProvider>of(new InMemoryAccountStoreProvider()),
                hashAlgorithms,
                cache,
                TestConfigs.resiliency(3),
                new RecordingPublisher(),
                Clock.systemUTC());
    }

    @Test
    @DisplayName("should build a default realm when none is configured")
    void shouldBuildDefaultRealm() {
        final var realms = registry(List.of()).realms();

        assertEquals(1, realms.size());
        assertEquals("default", realms.get(0).name());
    }

    @Test
    @DisplayName("should keep configured realm order")
    void shouldKeepConfiguredOrder() {
        final var realms = registry(List.of(TestConfigs.realm("corp"), TestConfigs.realm("partners"))).realms();

        assertEquals(List.of("corp", "partners"), realms.stream().map(Realm::name).toList());
    }

    @Test
    @DisplayName("should reject duplicate realm names")
    void shouldRejectDuplicates() {
        assertThrows(
                ConfigurationException.class,
                () -> registry(List.of(TestConfigs.realm("corp"), TestConfigs.realm("corp"))));
    }

    @Test
    @DisplayName("should reject a realm on an unknown account store")
    void shouldRejectUnknownStore() {
        final var ldap = new TestConfigs.RealmSettings("corp", "ldap", "indexed", "simple");

        assertThrows(ConfigurationException.class, () -> registry(List.of(ldap)));
    }

    @Test
    @DisplayName("should reject a store retry budget below one attempt")
    void shouldRejectZeroAttempts() {
        assertThrows(
                ConfigurationException.class,
                () -> new RealmRegistry(
                        List.of(TestConfigs.realm("corp")),
                        () -> Stream.<AccountStoreProvider>of(new InMemoryAccountStoreProvider()),
                        hashAlgorithms,
                        cache,
                        TestConfigs.resiliency(0),
                        new RecordingPublisher(),
                        Clock.systemUTC()));
    }
}
