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

package org.gnuhpc.cape.runtime.launcher;

import org.gnuhpc.cape.runtime.common.configuration.LifecycleConfig;
import org.gnuhpc.cape.runtime.common.server.HealthCheckServer;
import org.gnuhpc.cape.runtime.lifecycle.Hook;
import org.gnuhpc.cape.runtime.lifecycle.Lifecycle;
import org.gnuhpc.cape.runtime.lifecycle.LifecycleException;
import org.gnuhpc.cape.runtime.shutdown.Shutdowner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CapeRuntimeLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(CapeRuntimeLauncher.class);

    public static void main(String[] args) {
        LOG.info("========================================");
        LOG.info("Starting CAPE runtime");
        LOG.info("========================================");

        App app = createApp(new LifecycleConfig());
        try {
            app.run();
            LOG.info("CAPE runtime stopped");
        } catch (LifecycleException e) {
            LOG.error("CAPE runtime failed", e);
            System.exit(1);
        }
    }

    static App createApp(LifecycleConfig config) {
        App.Builder builder = App.builder()
                .config(config)
                .provide(LifecycleConfig.class, r -> config);

        if (config.isHealthCheckEnabled()) {
            builder.provide(HealthCheckServer.class, r -> {
                HealthCheckServer server = new HealthCheckServer(
                        r.get(LifecycleConfig.class).getHealthCheckPort(), r.get(Shutdowner.class));
                r.get(Lifecycle.class).append(Hook.forComponent(server));
                return server;
            });
            builder.invoke(r -> r.get(HealthCheckServer.class));
        }
        return builder.build();
    }
}
