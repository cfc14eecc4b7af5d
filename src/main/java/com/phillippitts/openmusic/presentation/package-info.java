/**
 * REST boundary: thin controllers over the resolver, the session queues and the cache, plus
 * the mapping of domain exceptions to HTTP responses.
 */
package com.phillippitts.openmusic.presentation;
