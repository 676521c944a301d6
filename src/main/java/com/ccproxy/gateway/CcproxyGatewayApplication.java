package com.ccproxy.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class CcproxyGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(CcproxyGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CcproxyGatewayApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           CCProxy Gateway v1.0.0                  ║");
        log.info("║   Anthropic / OpenAI / Google / AWS Converter     ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST /v1/convert/request?from=&to=");
        log.info("  POST /v1/convert/response?from=&to=");
        log.info("  POST /v1/tools/validate");
        log.info("  GET  /health");
    }
}
