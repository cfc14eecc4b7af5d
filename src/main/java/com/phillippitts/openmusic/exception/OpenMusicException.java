package com.phillippitts.openmusic.exception;

/**
 * Base exception for all open-music application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class OpenMusicException extends RuntimeException {

    public OpenMusicException(String message) {
        super(message);
    }

    public OpenMusicException(String message, Throwable cause) {
        super(message, cause);
    }

    public OpenMusicException(Throwable cause) {
        super(cause);
    }
}
