/*
 * Copyright 2015 Austin Keener, Michael Ritter, Florian Spieß, and the JDA contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * REST API communication features.
 *
 * <p>The {@link net.vpg.snowrest.api.requests.RestAction RestAction} interface is returned by every request
 * and decides how the result is awaited. Requests are grouped into rate-limit buckets and executed by the
 * {@link net.vpg.snowrest.api.requests.RestRateLimiter RestRateLimiter} configured in
 * {@link net.vpg.snowrest.api.requests.RestConfig RestConfig}.
 *
 * <p>In the case of a failed Request the RestAction will be provided with a
 * {@link net.vpg.snowrest.api.exceptions.RestException RestException}.
 */
package net.vpg.snowrest.api.requests;
