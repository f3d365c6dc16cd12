/*
 * Copyright 2024 Roman Khlebnov
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
 * Defines the message-driven core of the application.
 *
 * <p>Here is an example to help explain how different pieces are related to each other - let's
 * assume that a customer places an order:
 *
 * <ul>
 *   <li>The shop sends an {@link io.github.suppierk.allocation.cqrs.Command.Allocate} command to
 *       the {@link io.github.suppierk.allocation.cqrs.MessageBus}.
 *   <li>The bus finds the single handler of that command. The handler was bound earlier by the
 *       {@link io.github.suppierk.allocation.cqrs.DependencyInjector} to the collaborators it
 *       declares, such as the unit of work.
 *   <li>The handler changes the domain model, which records an {@link
 *       io.github.suppierk.allocation.cqrs.Event.Allocated} event.
 *   <li>The bus harvests that event from the unit of work via {@link
 *       io.github.suppierk.allocation.cqrs.EventCollector} and puts it in its queue.
 *   <li>Every handler of the event runs in turn: one publishes the fact to other systems, another
 *       updates the read model the shop later queries to show the order status.
 * </ul>
 */
package io.github.suppierk.allocation.cqrs;
