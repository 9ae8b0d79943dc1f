package me.golemcore.meter.port.outbound;

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

import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.domain.model.UsageSnapshot;

/**
 * Port for querying one metered vendor and normalizing its answer.
 *
 * <p>
 * Implementations never throw from {@link #fetch(ServiceConfig)}: every
 * failure (missing credential, rejected credential, network error,
 * unparseable response) is reported as an error snapshot.
 */
public interface UsageAdapterPort {

    /**
     * Stable service id, used as the key in config, cache, history and URLs.
     */
    String getServiceId();

    /**
     * Fetch current usage.
     *
     * @param config
     *            the service's settings, never {@code null}
     * @return a successful or error snapshot
     */
    UsageSnapshot fetch(ServiceConfig config);
}
