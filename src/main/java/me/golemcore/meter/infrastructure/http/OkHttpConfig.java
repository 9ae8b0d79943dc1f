package me.golemcore.meter.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the vendor usage adapters. Timeouts and pool
 * size come from {@code meter.http.*}; the call timeout bounds one vendor
 * request end to end.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final MeterProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        MeterProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(http.getCallTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(pool)
                .build();
    }
}
