package me.golemcore.codeshell.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.port.inbound.ChannelPort;
import me.golemcore.codeshell.port.outbound.ModelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans (clock, JSON mapper,
 * thread pools). Starts the enabled channels once the context is wired.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ShellProperties properties;
    private final ToolRegistry toolRegistry;
    private final ModelPort modelPort;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs agent loops. Unbounded so that a run stuck past its cancel timeout
     * never blocks the next one.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService sessionRunExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("agent-run-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService toolExecutorService() {
        return Executors.newCachedThreadPool(namedDaemonThreads("tool-exec-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService paneDeliveryExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("pane-delivery-"));
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore CodeShell starting...");
        log.info("Workspace: {}", Path.of(properties.getTools().getWorkspace()).toAbsolutePath().normalize());
        log.info("Model available: {}", modelPort.isAvailable());
        log.info("Tools: {}", toolRegistry.names());
        log.info("Max iterations per run: {}", properties.getLoop().getMaxIterations());

        for (ChannelPort channel : channelPorts) {
            if (isChannelEnabled(channel.getChannelType())) {
                log.info("Starting channel: {}", channel.getChannelType());
                channel.start();
            }
        }
    }

    private boolean isChannelEnabled(String channelType) {
        return "console".equals(channelType) && properties.getConsole().isEnabled();
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
