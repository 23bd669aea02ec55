package com.fry.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final PainEngineProperties properties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        log.info("Pain engine listening on port {} (API base: http://localhost:{}{}/api/pain)", port, port, contextPath);
        log.info("Tier thresholds shrimp<={} retail<={} whale>={}; multiplier range [{}, {}]",
                properties.getTiers().getShrimpMax(),
                properties.getTiers().getRetailMax(),
                properties.getTiers().getWhaleMin(),
                properties.getMultiplier().getMin(),
                properties.getMultiplier().getMax());
    }
}
