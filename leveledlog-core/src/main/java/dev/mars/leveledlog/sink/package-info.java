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
/**
 * Log record sinks.
 * <ul>
 *   <li>{@link dev.mars.leveledlog.sink.ModuleLevelSink} - per-module thresholds with prefix lookup</li>
 *   <li>{@link dev.mars.leveledlog.sink.MultiSink} - fan-out to several sinks, each with its own table</li>
 *   <li>{@link dev.mars.leveledlog.sink.DeliverySink} - synchronous or background delivery</li>
 *   <li>{@link dev.mars.leveledlog.sink.FileSinkRegistry} - one writer per file path</li>
 *   <li>{@link dev.mars.leveledlog.sink.HttpSink} - records sent to an HTTP endpoint</li>
 * </ul>
 * <p>
 * <b>Failure model:</b> every sink failure surfaces as a
 * {@link dev.mars.leveledlog.sink.SinkException}; background failures go to the
 * {@value dev.mars.leveledlog.sink.DeliverySink#DIAGNOSTICS_LOGGER} logger.
 */
package dev.mars.leveledlog.sink;
