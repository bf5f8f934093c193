package com.calai.calibration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class CalibrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalibrationApplication.class, args);
    }

    /**
     * 測試環境不啟動排程（H2 建表前不要讓 job 去掃 parameter_proposals）
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
