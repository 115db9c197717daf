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
 * Utilities of the library, useful for the library user as well.
 * <ul>
 *     <li>{@link net.vpg.snowrest.api.utils.FileUpload FileUpload}
 *     <br>Attachments for multipart requests</li>
 *     <li>{@link net.vpg.snowrest.api.utils.MiscUtil MiscUtil}
 *     <br>Various operations that don't have specific utility classes yet</li>
 * </ul>
 */
package net.vpg.snowrest.api.utils;
