package com.behindbars.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.behindbars.backend.facility.FacilityCatalog;
import com.behindbars.backend.pipeline.DailyRunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class BehindBarsApplicationTests {

    @Autowired
    private FacilityCatalog facilityCatalog;

    @Autowired
    private DailyRunService dailyRunService;

    @Test
    void contextLoads() {
        assertThat(facilityCatalog.facilityCount()).isGreaterThan(10);
        assertThat(dailyRunService).isNotNull();
    }
}
