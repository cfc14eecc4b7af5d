package com.phillippitts.openmusic.service.cache;

/**
 * Outcome of one optimization pass.
 *
 * @param pressure pressure observed after TTL cleanup
 * @param expiredRemoved entries dropped for exceeding their TTL
 * @param evicted entries dropped in response to memory pressure
 */
public record OptimizationReport(MemoryPressure pressure, int expiredRemoved, int evicted) {
}
