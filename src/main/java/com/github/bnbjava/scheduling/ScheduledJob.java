package com.github.bnbjava.scheduling;

/**
 * One entry of a machine timeline.
 *
 * @param position the position in the sequence, from zero
 * @param job      the job index in the problem
 * @param id       the job identifier
 * @param start    start time
 * @param finish   completion time
 * @param idle     machine idle time immediately before the start, waiting for the release date
 */
public record ScheduledJob(int position, int job, String id, double start, double finish, double idle) {
}
