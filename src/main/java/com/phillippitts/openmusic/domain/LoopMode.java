package com.phillippitts.openmusic.domain;

/** Repeat policy applied by the playback queue when the current item finishes. */
public enum LoopMode {
    OFF,
    TRACK,
    QUEUE
}
