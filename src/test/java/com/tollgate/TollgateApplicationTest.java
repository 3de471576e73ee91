package com.tollgate;

import com.tollgate.admission.AdmissionGate;
import com.tollgate.cache.ResponseCache;
import com.tollgate.service.ProviderService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = "tollgate.admission.max-threads=3")
class TollgateApplicationTest {

    @Autowired
    private ResponseCache responseCache;

    @Autowired
    private AdmissionGate admissionGate;

    @Autowired
    private ProviderService providerService;

    @Test
    void testContextLoadsWithDefaults() {
        assertEquals(3, admissionGate.getCapacity());
        assertEquals(300, responseCache.metrics().getTtlInSeconds());
        assertEquals(100, responseCache.metrics().getMaxSize());
        assertEquals("groq", providerService.getDefaultProvider().getId());
    }
}
