/**
 * JSON controllers. Controllers only translate HTTP to service calls; failures surface as
 * exceptions handled by {@code GlobalExceptionHandler}.
 */
package com.phillippitts.openmusic.presentation.controller;
