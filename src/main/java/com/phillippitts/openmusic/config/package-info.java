/**
 * Spring configuration: executors, HTTP client, time source and typed properties.
 *
 * <p>All {@code @ConfigurationProperties} classes are registered on
 * {@link com.phillippitts.openmusic.OpenMusicApplication} and validated at startup, so a
 * misconfigured backend chain fails the context instead of the first request.
 */
package com.phillippitts.openmusic.config;
