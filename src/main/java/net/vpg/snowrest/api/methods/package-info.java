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
 * Resource modules of the REST API.
 * <br>Every method validates its arguments, compiles the route and returns the
 * {@link net.vpg.snowrest.api.requests.RestAction RestAction} of
 * {@link net.vpg.snowrest.api.SnowRest#request(net.vpg.snowrest.api.requests.Route.CompiledRoute, net.vpg.snowrest.api.requests.RestBody, java.util.Map) SnowRest.request}.
 */
package net.vpg.snowrest.api.methods;
