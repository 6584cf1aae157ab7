package com.secops.threatintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 威胁情报数据访问服务
 */
@SpringBootApplication
@EnableScheduling
public class ThreatIntelAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreatIntelAccessApplication.class, args);
    }
}
