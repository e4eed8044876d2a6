package tech.terrareg.platform.shared;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Provides the UTC clock used for every expiry comparison.
 * Tests construct services with a fixed clock instead.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    Clock utcClock() {
        return Clock.systemUTC();
    }
}
