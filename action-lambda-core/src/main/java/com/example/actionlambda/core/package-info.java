/**
 * Root package of the action lambda database layer.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.actionlambda.core.error.ClassifiedException} – failure tagged with
 *       retry/alert/dead-letter/history flags.
 *   <li>{@link com.example.actionlambda.core.jdbc.ConnectionPoolManager} – lazily initialized
 *       HikariCP pool built from {@link com.example.actionlambda.core.jdbc.PoolSettings}.
 *   <li>{@link com.example.actionlambda.core.jdbc.ConnectionGuard} – returns a borrowed connection
 *       to the pool exactly once.
 *   <li>{@link com.example.actionlambda.core.jdbc.Cursor} – buffered cursor returning rows as
 *       column-keyed maps.
 *   <li>{@link com.example.actionlambda.core.jdbc.RetryingQueryExecutor} – retries lock wait
 *       timeouts and deadlocks with {@link com.example.actionlambda.core.jdbc.Backoff}.
 *   <li>{@link com.example.actionlambda.core.repository.SiteMasterRepository} – tenant site
 *       configuration lookup.
 *   <li>{@link com.example.actionlambda.core.secrets.SecretHelper} – optional database credentials
 *       from AWS Secrets Manager.
 * </ul>
 */
package com.example.actionlambda.core;
