package org.operaton.hikeprep;

import org.junit.jupiter.api.Test;
import org.operaton.hikeprep.config.FixedClockConfiguration;
import org.operaton.hikeprep.service.TrainingPlanService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(FixedClockConfiguration.class)
class HikePrepApplicationTest {

    @Autowired
    private TrainingPlanService trainingPlanService;

    @Autowired
    private Clock clock;

    @Test
    void contextLoads() {
        assertNotNull(trainingPlanService);
        assertEquals(FixedClockConfiguration.NOW, clock.instant());
    }
}
