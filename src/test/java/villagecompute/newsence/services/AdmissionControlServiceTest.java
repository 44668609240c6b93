package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.newsence.TestConstants;
import villagecompute.newsence.observability.PipelineMetrics;
import villagecompute.newsence.services.AdmissionControlService.AdmissionResult;

/**
 * Unit tests for {@link AdmissionControlService}.
 */
class AdmissionControlServiceTest {

    private static final String KEY = "ip:" + TestConstants.CLIENT_IP;

    private AdmissionControlService service;

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new AdmissionControlService();
        service.metrics = new PipelineMetrics(registry);
        service.clock = Clock.fixed(TestConstants.NOW, ZoneOffset.UTC);
    }

    private void advanceSeconds(long seconds) {
        service.clock = Clock.offset(service.clock, Duration.ofSeconds(seconds));
    }

    @Test
    void testHit_BatchLargerThanCapacityIsRejectedWhole() {
        AdmissionResult rejected = service.hit(KEY, 3, 60, 5);

        assertFalse(rejected.admitted(), "A batch of 5 must not fit a capacity of 3");
        assertEquals(60, rejected.retryAfterSeconds(), "Fresh bucket reports the full window");

        // Nothing was charged, so the full capacity is still available
        assertTrue(service.hit(KEY, 3, 60, 3).admitted());
        assertFalse(service.hit(KEY, 3, 60, 1).admitted());
    }

    @Test
    void testHit_AccumulatesWithinWindow() {
        assertTrue(service.hit(KEY, 5, 60, 2).admitted());
        assertTrue(service.hit(KEY, 5, 60, 3).admitted());

        advanceSeconds(10);
        AdmissionResult rejected = service.hit(KEY, 5, 60, 1);

        assertFalse(rejected.admitted());
        assertEquals(50, rejected.retryAfterSeconds(), "Retry-after counts down to the window reset");
    }

    @Test
    void testHit_RejectionDoesNotConsumeCapacity() {
        assertTrue(service.hit(KEY, 5, 60, 4).admitted());
        assertFalse(service.hit(KEY, 5, 60, 2).admitted());
        assertTrue(service.hit(KEY, 5, 60, 1).admitted(), "The rejected batch must not have been charged");
    }

    @Test
    void testHit_WindowExpiryStartsFreshWindow() {
        assertTrue(service.hit(KEY, 2, 60, 2).admitted());
        assertFalse(service.hit(KEY, 2, 60, 1).admitted());

        advanceSeconds(60);

        assertTrue(service.hit(KEY, 2, 60, 2).admitted(), "An expired window is replaced");
    }

    @Test
    void testHit_KeysAreIndependent() {
        assertTrue(service.hit("user:alice", 1, 60, 1).admitted());
        assertTrue(service.hit("user:bob", 1, 60, 1).admitted());
        assertFalse(service.hit("user:alice", 1, 60, 1).admitted());
    }

    @Test
    void testHit_RecordsAdmissionMetrics() {
        service.hit(KEY, 1, 60, 1);
        service.hit(KEY, 1, 60, 1);

        assertEquals(1.0, registry.get("newsence_admission_total").tag("decision", "admitted").counter().count());
        assertEquals(1.0, registry.get("newsence_admission_total").tag("decision", "rejected").counter().count());
    }

    @Test
    void testBucketKey_PrefersUserThenIpThenAnonymous() {
        assertEquals("user:alice", AdmissionControlService.bucketKey(" alice ", TestConstants.CLIENT_IP));
        assertEquals("ip:" + TestConstants.CLIENT_IP, AdmissionControlService.bucketKey("  ", TestConstants.CLIENT_IP));
        assertEquals(AdmissionControlService.ANONYMOUS_KEY, AdmissionControlService.bucketKey(null, null));
    }
}
