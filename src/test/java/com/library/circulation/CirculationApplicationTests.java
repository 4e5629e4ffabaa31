package com.library.circulation;

import com.library.circulation.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

class CirculationApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Spring context, Flyway migrations and Hibernate schema validation.
    }
}
