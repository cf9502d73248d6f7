/**
 * Root API of QOMS, a resource-gated, priority-ordered operation queue.
 *
 * <h2>Core Design</h2>
 * <p>Callers submit {@link io.qoms.Operation operations} to a {@link io.qoms.Qoms} instance
 * at one of five {@linkplain io.qoms.Priority tiers}. A single
 * {@linkplain io.qoms.dispatch.Dispatcher dispatcher} drains the tiers in priority order,
 * FIFO within a tier, starting an operation only when the
 * {@linkplain io.qoms.resource.AdmissionPolicy admission policy} finds CPU and RAM below the
 * configured ceilings. Long-waiting items are promoted one tier at a time.
 *
 * <p>Each dispatch holds a lease. Success is acknowledged (ACK) and completes the caller's
 * future; failure is negatively acknowledged (NACK) and retried with exponential backoff
 * until {@code maxRetries}, after which the item lands in the
 * {@linkplain io.qoms.dead.DeadLetterQueue dead-letter queue}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>qoms-core</b>: scheduler, admission, retry, dead letters (zero external deps)</li>
 *   <li><b>qoms-micrometer</b>: {@link io.qoms.spi.MetricsExporter} backed by Micrometer</li>
 *   <li><b>qoms-spring-boot-starter</b>: auto-configuration bound to {@code qoms.*}
 *       properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (Qoms qoms = Qoms.builder()
 *     .config(QomsConfig.builder()
 *         .maxCpuPercent(70)
 *         .maxRetries(5)
 *         .build())
 *     .build()) {
 *
 *     CompletableFuture<Integer> indexed = qoms.low(() -> indexer.reindex(project));
 *     CompletableFuture<String> answer = qoms.critical(() -> search.query(prompt));
 *
 *     QueueStats stats = qoms.getStats();
 *     List<DeadLetterEntry> failures = qoms.getDeadLetters();
 * }
 * }</pre>
 *
 * @see io.qoms.Qoms
 * @see io.qoms.QomsConfig
 * @see io.qoms.dispatch.Dispatcher
 */
package io.qoms;
