/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.agentloop.core.model;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to an LLM completion endpoint. Retries, if any, are the implementation's concern.
 */
public interface ModelClient {
    /**
     * Model name used in usage reports
     */
    String model();

    /**
     * Run a sampling request. Cancelling the returned future must abort the underlying call where possible.
     *
     * @param request Full request
     * @return Future that completes with the response, or exceptionally on failure
     */
    CompletableFuture<ModelResponse> sample(ModelRequest request);
}
