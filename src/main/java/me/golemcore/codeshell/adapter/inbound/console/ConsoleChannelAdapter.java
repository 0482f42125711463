package me.golemcore.codeshell.adapter.inbound.console;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.service.PaneSubscription;
import me.golemcore.codeshell.domain.service.SessionController;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.port.inbound.ChannelPort;
import me.golemcore.codeshell.port.inbound.CommandPort.CommandResult;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stdin/stdout channel. Reads one line per prompt: slash commands go to the
 * {@link ConsoleCommandRouter}, anything else is submitted to the session.
 * The panes are rendered by {@link ConsolePaneRenderer} on the same output.
 *
 * <p>
 * Input is read on its own non-daemon thread, so the application stays up
 * until /exit or end of input.
 */
@Component
@Slf4j
public class ConsoleChannelAdapter implements ChannelPort {

    private static final String CHANNEL_TYPE = "console";

    private final SessionController sessionController;
    private final ConsoleCommandRouter commandRouter;
    private final ConsolePaneRenderer paneRenderer;
    private final String prompt;
    private final BufferedReader input;
    private final PrintStream output;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<PaneSubscription> subscriptions = new ArrayList<>();
    private Thread readerThread;

    public ConsoleChannelAdapter(SessionController sessionController, ConsoleCommandRouter commandRouter,
            ConsolePaneRenderer paneRenderer, ShellProperties properties) {
        this(sessionController, commandRouter, paneRenderer, properties,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    // Visible for testing
    ConsoleChannelAdapter(SessionController sessionController, ConsoleCommandRouter commandRouter,
            ConsolePaneRenderer paneRenderer, ShellProperties properties, BufferedReader input,
            PrintStream output) {
        this.sessionController = sessionController;
        this.commandRouter = commandRouter;
        this.paneRenderer = paneRenderer;
        this.prompt = properties.getConsole().getPrompt();
        this.input = input;
        this.output = output;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        subscriptions.addAll(paneRenderer.attach(output));
        readerThread = new Thread(this::readLoop, "console-input");
        readerThread.start();
        log.info("[Console] Channel started");
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        subscriptions.forEach(PaneSubscription::close);
        subscriptions.clear();
        if (readerThread != null && readerThread != Thread.currentThread()) {
            readerThread.interrupt();
        }
        log.info("[Console] Channel stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // Visible for testing
    void readLoop() {
        output.println("GolemCore CodeShell. Type /help for commands.");
        try {
            while (running.get()) {
                output.print(prompt);
                output.flush();
                String line = input.readLine();
                if (line == null) {
                    break;
                }
                if (!handleLine(line.strip())) {
                    break;
                }
            }
        } catch (IOException e) {
            log.warn("[Console] Input closed: {}", e.getMessage());
        } finally {
            stop();
        }
    }

    /**
     * @return false when the channel should stop reading
     */
    boolean handleLine(String line) {
        if (line.isEmpty()) {
            return true;
        }
        if (!ConsoleCommandRouter.isCommand(line)) {
            sessionController.submit(line);
            return true;
        }
        try {
            CommandResult result = commandRouter.executeLine(line).get();
            output.println(result.output());
            return !result.exitRequested();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("[Console] Command failed: {}", line, e.getCause());
            output.println("Command failed: " + e.getCause().getMessage());
            return true;
        }
    }
}
