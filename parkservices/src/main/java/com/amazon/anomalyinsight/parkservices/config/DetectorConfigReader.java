/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyinsight.parkservices.config;

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads a {@link DetectorConfig} from JSON and validates it. Enum values are
 * matched case insensitively, so {@code "isolation_forest"} and
 * {@code "ISOLATION_FOREST"} name the same model type.
 */
public class DetectorConfigReader {

    private final ObjectMapper objectMapper;

    public DetectorConfigReader() {
        this.objectMapper = JsonMapper.builder().enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS).build();
    }

    public DetectorConfig read(InputStream inputStream) throws IOException {
        checkNotNull(inputStream, "inputStream must not be null");
        return validated(objectMapper.readValue(inputStream, DetectorConfig.class));
    }

    public DetectorConfig read(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        }
    }

    public DetectorConfig read(String json) throws IOException {
        checkNotNull(json, "json must not be null");
        return validated(objectMapper.readValue(json, DetectorConfig.class));
    }

    public String write(DetectorConfig config) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    private static DetectorConfig validated(DetectorConfig config) {
        config.validate();
        return config;
    }
}
