/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.openmusic.exception.OpenMusicException} so that the REST boundary can
 * map them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.openmusic.exception.BackendException} - a single adapter
 *       attempt failed; subclasses encode whether the resolver retries
 *       ({@link com.phillippitts.openmusic.exception.BackendTimeoutException}), skips the backend
 *       for the call ({@link com.phillippitts.openmusic.exception.BackendProtocolException}) or
 *       logs and moves on ({@link com.phillippitts.openmusic.exception.BackendUnavailableException})</li>
 *   <li>{@link com.phillippitts.openmusic.exception.NoResultsException} - terminal failure of a
 *       resolution call, carrying the attempted backend names</li>
 *   <li>{@link com.phillippitts.openmusic.exception.QueueFullException} and
 *       {@link com.phillippitts.openmusic.exception.QuarantinedItemException} - returned to the
 *       caller of a queue operation for user-facing messaging</li>
 * </ul>
 *
 * <p>Raw adapter exceptions never escape the resolver, and cache failures never escape the cache.
 *
 * @see com.phillippitts.openmusic.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.openmusic.exception;
