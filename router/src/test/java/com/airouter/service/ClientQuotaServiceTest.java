package com.airouter.service;

import com.airouter.config.RouterProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientQuotaServiceTest {

    @Test
    void rejectsOnceTheMinuteQuotaIsSpent() {
        ClientQuotaService quota = service(true, 3);

        assertTrue(quota.tryConsume("caller-1"));
        assertTrue(quota.tryConsume("caller-1"));
        assertTrue(quota.tryConsume("caller-1"));
        assertFalse(quota.tryConsume("caller-1"));

        // quotas are per caller
        assertTrue(quota.tryConsume("caller-2"));
        assertEquals(0, quota.getQuotaInfo("caller-1").remaining());
        assertEquals(2, quota.getQuotaInfo("caller-2").remaining());
    }

    @Test
    void resetRestoresTheFullQuota() {
        ClientQuotaService quota = service(true, 1);
        quota.tryConsume("caller");
        assertFalse(quota.tryConsume("caller"));

        quota.resetLimit("caller");

        assertEquals(1, quota.getQuotaInfo("caller").remaining());
        assertTrue(quota.tryConsume("caller"));
    }

    @Test
    void missingIdentifierSharesTheAnonymousBucket() {
        ClientQuotaService quota = service(true, 1);

        assertTrue(quota.tryConsume(null));
        assertFalse(quota.tryConsume(""));
        assertEquals(0, quota.getQuotaInfo(ClientQuotaService.ANONYMOUS).remaining());
    }

    @Test
    void disabledQuotaAllowsEverything() {
        ClientQuotaService quota = service(false, 1);

        for (int i = 0; i < 10; i++) {
            assertTrue(quota.tryConsume("caller"));
        }
        assertEquals(Integer.MAX_VALUE, quota.getQuotaInfo("caller").limit());
    }

    @Test
    void longIdentifiersAreMaskedInLogs() {
        assertEquals("sk-1...wxyz", ClientQuotaService.mask("sk-1234567890abcdefwxyz"));
        assertEquals("short", ClientQuotaService.mask("short"));
    }

    private static ClientQuotaService service(boolean enabled, int perMinute) {
        RouterProperties properties = new RouterProperties();
        properties.getClientQuota().setEnabled(enabled);
        properties.getClientQuota().setRequestsPerMinute(perMinute);
        ClientQuotaService service = new ClientQuotaService(properties, new SimpleMeterRegistry());
        service.init();
        return service;
    }
}
