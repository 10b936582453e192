/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.leveledlog.demo;

import dev.mars.leveledlog.config.LeveledLogConfig;
import dev.mars.leveledlog.config.LoggingSettings;
import dev.mars.leveledlog.config.ModuleSpec;
import dev.mars.leveledlog.config.SinkFactory;
import dev.mars.leveledlog.config.SinkSpec;
import dev.mars.leveledlog.core.Redaction;
import dev.mars.leveledlog.logger.Logger;
import dev.mars.leveledlog.logger.LoggingContext;
import dev.mars.leveledlog.logger.PrefixedLogger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Demo entry point for the leveled logging library.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Loading configuration</li>
 *   <li>Per-module thresholds with prefix lookup</li>
 *   <li>A module with its own file sink next to the default sink</li>
 *   <li>Prefixed loggers and redacted secrets</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link LeveledLogConfig} with the following priority:
 * <ol>
 *   <li>System properties: {@code -Dleveledlog.defaultLevel=INFO -Dleveledlog.color=true ...}</li>
 *   <li>Environment variables: {@code LEVELEDLOG_DEFAULT_LEVEL, LEVELEDLOG_COLOR, ...}</li>
 *   <li>Properties file: {@code leveledlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 * An optional first argument names a JSON settings file; without it a built-in setup is used.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build and collect the runtime classpath
 * mvn package dependency:build-classpath -Dmdep.outputFile=cp.txt -pl leveledlog-demo -am
 *
 * # Run with default configuration
 * java -cp "leveledlog-demo/target/classes:$(cat leveledlog-demo/cp.txt)" dev.mars.leveledlog.demo.LoggingDemo
 *
 * # Run with a settings file and INFO as default level
 * java -Dleveledlog.defaultLevel=INFO -cp ... dev.mars.leveledlog.demo.LoggingDemo logging.json
 * </pre>
 *
 * @see LeveledLogConfig
 * @see LoggingSettings
 */
public class LoggingDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Leveled Logging Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        LeveledLogConfig config = LeveledLogConfig.load();
        System.out.println("Configuration: " + config);
        System.out.println();

        Path auditLog = Files.createTempFile("leveledlog-demo-audit", ".log");
        LoggingSettings settings = args.length > 0 && !args[0].isBlank()
                ? LoggingSettings.fromJson(Files.readString(Path.of(args[0])))
                : defaultSettings(auditLog);

        try (LoggingContext context = config.contextBuilder().build();
             SinkFactory sinks = new SinkFactory(context, config)) {
            sinks.apply(settings);
            System.out.println("[OK] Applied settings: " + settings);
            System.out.println();

            Logger api = context.logger("svc.api");
            Logger apiHttp = context.logger("svc.api.http");
            Logger db = context.logger("svc.db");
            Logger audit = context.logger("audit");

            api.info("api started");                       // suppressed: svc.api is at WARNING
            apiHttp.warning("slow request:", 1200, "ms");  // emitted through the svc.api entry
            db.debugf("pool size %d", 8);
            audit.notice("user", "alice", "logged in with token", Redaction.secret("s3cr3t-token"));

            Logger worker = PrefixedLogger.of(context.logger("svc.worker"), "[job-42]");
            worker.info("processing batch", 3, "of", 10);
            worker.errorf("retry %d failed", 2);
        }

        if (args.length == 0) {
            System.out.println();
            System.out.println("[OK] Audit file " + auditLog + ":");
            for (String line : Files.readAllLines(auditLog, StandardCharsets.UTF_8)) {
                System.out.println("    " + line);
            }
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Logging demo complete!               |");
        System.out.println("+---------------------------------------+");
    }

    private static LoggingSettings defaultSettings(Path auditLog) {
        return new LoggingSettings("DEBUG", List.of(
                new ModuleSpec("svc.api", "WARNING", List.of()),
                new ModuleSpec("audit", "NOTICE", List.of(
                        SinkSpec.of("-"),
                        new SinkSpec(auditLog.toString(), "N", Map.of("async", false, "truncate", true))))
        ));
    }
}
