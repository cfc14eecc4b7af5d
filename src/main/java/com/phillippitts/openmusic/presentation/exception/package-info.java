/**
 * Exception-to-HTTP mapping for the REST boundary.
 */
package com.phillippitts.openmusic.presentation.exception;
