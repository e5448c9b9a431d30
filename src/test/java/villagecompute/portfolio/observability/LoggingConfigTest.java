package villagecompute.portfolio.observability;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.services.ClientIdentityResolver;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConfigTest {

    @AfterEach
    void tearDown() {
        LoggingConfig.clearMDC();
    }

    @Test
    void testSetClientFingerprint_PutsResolverFingerprintAndClearRemovesIt() {
        String fingerprint = new ClientIdentityResolver().fingerprint("203.0.113.7", "Mozilla/5.0");

        LoggingConfig.setClientIp("203.0.113.7");
        LoggingConfig.setClientFingerprint(fingerprint);

        assertEquals(fingerprint, MDC.get(LoggingConfig.MDC_CLIENT_FINGERPRINT));
        assertEquals(16, fingerprint.length());

        LoggingConfig.clearMDC();

        assertNull(MDC.get(LoggingConfig.MDC_CLIENT_FINGERPRINT));
        assertNull(MDC.get(LoggingConfig.MDC_CLIENT_IP));
    }

    @Test
    void testSetClientFingerprint_NullIgnored() {
        LoggingConfig.setClientFingerprint(null);

        assertNull(MDC.get(LoggingConfig.MDC_CLIENT_FINGERPRINT));
    }
}
