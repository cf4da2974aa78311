/**
 * Core data model of the content delivery pipeline.
 *
 * <p>Every type in this package is immutable and serializes to self-describing JSON,
 * so a cold read from the durable cache after a restart needs no other context.</p>
 *
 * <h2>Content</h2>
 * <ul>
 *   <li>{@link com.ryuqq.publisher.core.model.ContentPiece} - one schedulable unit of output</li>
 *   <li>{@link com.ryuqq.publisher.core.model.PlanSummary} - master/micro plan awaiting sign-off</li>
 *   <li>{@link com.ryuqq.publisher.core.model.Platform} - target platform identifier</li>
 * </ul>
 *
 * <h2>Approval</h2>
 * <ul>
 *   <li>{@link com.ryuqq.publisher.core.model.ApprovalRequest} - tracked approval envelope</li>
 *   <li>{@link com.ryuqq.publisher.core.model.Continuation} - tagged follow-up action</li>
 * </ul>
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>{@link com.ryuqq.publisher.core.model.DeliveryOptions} - per-submission options</li>
 *   <li>{@link com.ryuqq.publisher.core.model.DeliveryResult} - structured outcome of a submission</li>
 *   <li>{@link com.ryuqq.publisher.core.model.ScheduledDeliveryEntry} - persisted future delivery</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Publisher Team
 */
package com.ryuqq.publisher.core.model;
