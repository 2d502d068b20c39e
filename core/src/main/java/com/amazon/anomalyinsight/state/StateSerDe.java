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

package com.amazon.anomalyinsight.state;

import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON serialization of a model through its state object. The mapper turns the
 * model into a state bean and Jackson writes the bean.
 *
 * @param <M> the model type
 * @param <S> the state type
 */
@Getter
public class StateSerDe<M, S> {

    private final IStateMapper<M, S> mapper;

    private final Class<S> stateClass;

    private final ObjectMapper objectMapper;

    public StateSerDe(IStateMapper<M, S> mapper, Class<S> stateClass) {
        this(mapper, stateClass, defaultObjectMapper());
    }

    public StateSerDe(IStateMapper<M, S> mapper, Class<S> stateClass, ObjectMapper objectMapper) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
        this.stateClass = checkNotNull(stateClass, "stateClass must not be null");
        this.objectMapper = checkNotNull(objectMapper, "objectMapper must not be null");
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    public String toJson(M model) throws JsonProcessingException {
        return objectMapper.writeValueAsString(mapper.toState(model));
    }

    public M fromJson(String json) throws JsonProcessingException {
        return mapper.toModel(objectMapper.readValue(json, stateClass));
    }

    public void write(M model, Path path) throws IOException {
        Files.write(path, objectMapper.writeValueAsBytes(mapper.toState(model)));
    }

    public M read(Path path) throws IOException {
        return mapper.toModel(objectMapper.readValue(Files.readAllBytes(path), stateClass));
    }
}
