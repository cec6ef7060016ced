package com.apiplatform.controller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Gateway Controller Application
 * Hosts the EventHub that propagates resource changes between controller replicas
 */
@SpringBootApplication
@EnableConfigurationProperties
public class GatewayControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayControllerApplication.class, args);
    }
}
