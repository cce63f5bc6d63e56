package com.firstcrack.service.schedule;

import java.time.Instant;

/**
 * Runs tasks at absolute wall-clock instants.
 *
 * A fire time already in the past runs as soon as possible. Tasks never run
 * before their fire time.
 */
public interface StageTimer {

    Cancellable scheduleAt(Instant fireTime, Runnable task);
}
