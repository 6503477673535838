package bastion.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.arc.DefaultBean;

import bastion.adapter.out.storage.memory.InMemoryFailedAttemptRepository;
import bastion.adapter.out.storage.memory.InMemorySessionRepository;
import bastion.core.port.out.SessionRepository;
import bastion.spi.FailedAttemptRepository;

/**
 * Default beans used when the application supplies none of its own.
 *
 * <p>Storage defaults are in-memory and suit a single instance only. Provide a
 * {@link SessionRepository} or {@link FailedAttemptRepository} bean to replace them.
 */
@ApplicationScoped
public class EngineProducers {

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public FailedAttemptRepository failedAttemptRepository(Clock clock) {
        return new InMemoryFailedAttemptRepository(clock);
    }

    void closeFailedAttemptRepository(@Disposes FailedAttemptRepository repository) {
        if (repository instanceof InMemoryFailedAttemptRepository inMemory) {
            inMemory.shutdown();
        }
    }
}
