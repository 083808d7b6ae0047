package com.obsinity.metricstream.spring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetricStreamApplication {
    public static void main(String[] args) {
        SpringApplication.run(MetricStreamApplication.class, args);
    }
}
