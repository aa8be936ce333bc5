/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gnuhpc.cape.runtime.common.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.gnuhpc.cape.runtime.lifecycle.HookContext;
import org.gnuhpc.cape.runtime.lifecycle.ServerComponent;
import org.gnuhpc.cape.runtime.shutdown.BroadcastException;
import org.gnuhpc.cape.runtime.shutdown.Shutdowner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Small HTTP endpoint reporting process health, plus a {@code POST /shutdown} that asks the
 * running application to stop.
 */
public class HealthCheckServer implements ServerComponent {

    private static final Logger LOG = LoggerFactory.getLogger(HealthCheckServer.class);

    // Upper bound for in-flight exchanges, such as the POST /shutdown that triggered the stop.
    private static final int STOP_DRAIN_SECONDS = 1;

    private final int port;
    private final Shutdowner shutdowner;

    private volatile HttpServer httpServer;
    private volatile long startTimeMillis;

    /**
     * @param port port to bind, 0 for an ephemeral one
     */
    public HealthCheckServer(int port, Shutdowner shutdowner) {
        this.port = port;
        this.shutdowner = shutdowner;
    }

    @Override
    public void start(HookContext ctx) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", new HealthHandler());
        server.createContext("/shutdown", new ShutdownHandler());
        server.setExecutor(null);
        server.start();

        this.startTimeMillis = System.currentTimeMillis();
        this.httpServer = server;
        LOG.info("Health check server started on port {}", server.getAddress().getPort());
    }

    @Override
    public void stop(HookContext ctx) {
        HttpServer server = httpServer;
        if (server != null) {
            server.stop(STOP_DRAIN_SECONDS);
            httpServer = null;
            LOG.info("Health check server stopped");
        }
    }

    @Override
    public String getName() {
        return "HealthCheckServer";
    }

    @Override
    public boolean isRunning() {
        return httpServer != null;
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public int getPort() {
        HttpServer server = httpServer;
        return server == null ? -1 : server.getAddress().getPort();
    }

    private static void respond(HttpExchange exchange, int statusCode, String body) throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            long uptimeSeconds = (System.currentTimeMillis() - startTimeMillis) / 1000;
            StringBuilder response = new StringBuilder();
            response.append("{\n");
            response.append("  \"status\": \"healthy\",\n");
            response.append("  \"uptime_seconds\": ").append(uptimeSeconds).append(",\n");
            response.append("  \"timestamp\": ").append(System.currentTimeMillis()).append("\n");
            response.append("}");
            respond(exchange, 200, response.toString());
        }
    }

    private class ShutdownHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 405, "{\"error\": \"method not allowed\"}");
                return;
            }

            LOG.info("Shutdown requested over HTTP from {}", exchange.getRemoteAddress());
            try {
                shutdowner.requestShutdown();
            } catch (BroadcastException e) {
                LOG.warn("Shutdown request was not delivered to every listener: {}", e.getMessage());
                respond(exchange, 503, "{\"status\": \"not_delivered\", \"error\": \""
                        + e.getMessage() + "\"}");
                return;
            }
            respond(exchange, 202, "{\"status\": \"shutting_down\"}");
        }
    }
}
