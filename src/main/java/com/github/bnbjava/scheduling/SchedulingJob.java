package com.github.bnbjava.scheduling;

import com.github.bnbjava.model.InvalidInputException;

import java.util.Map;

/**
 * A job for the single machine.
 *
 * @param id             identifier, used in reports
 * @param processingTime positive processing time
 * @param dueDate        due date, or null if the job has none
 * @param weight         positive weight
 * @param releaseDate    earliest start time, non-negative
 */
public record SchedulingJob(String id, double processingTime, Double dueDate, double weight, double releaseDate) {
    /**
     * Validating constructor.
     */
    public SchedulingJob {
        if (id == null) {
            throw new InvalidInputException("job id must not be null.");
        }
        if (!(processingTime > 0.0) || Double.isInfinite(processingTime)) {
            throw new InvalidInputException("processing time of job " + id + " must be positive.");
        }
        if (dueDate != null && !Double.isFinite(dueDate)) {
            throw new InvalidInputException("due date of job " + id + " must be finite.");
        }
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new InvalidInputException("weight of job " + id + " must be positive.");
        }
        if (!(releaseDate >= 0.0) || Double.isInfinite(releaseDate)) {
            throw new InvalidInputException("release date of job " + id + " must be non-negative.");
        }
    }

    /**
     * A job with weight 1, no due date, released at time 0.
     *
     * @param id             identifier
     * @param processingTime positive processing time
     */
    public SchedulingJob(String id, double processingTime) {
        this(id, processingTime, null, 1.0, 0.0);
    }

    /**
     * A weighted job with no due date, released at time 0.
     *
     * @param id             identifier
     * @param processingTime positive processing time
     * @param weight         positive weight
     */
    public SchedulingJob(String id, double processingTime, double weight) {
        this(id, processingTime, null, weight, 0.0);
    }

    /**
     * Build a job from a tabular record, such as a row of a data set read by an external loader. Recognized keys are
     * <code>id</code>, <code>processing_time</code> (required), <code>due_date</code>, <code>weight</code> (default 1)
     * and <code>release_date</code> (default 0). Values may be numbers or strings; missing, null or blank values take
     * the default.
     *
     * @param record the record
     * @return the job
     * @throws InvalidInputException if a value is missing, not numeric, or invalid
     */
    public static SchedulingJob fromRecord(Map<String, ?> record) {
        var id = record.get("id");
        var processingTime = number(record, "processing_time");

        if (id == null || processingTime == null) {
            throw new InvalidInputException("record must have an id and a processing_time: " + record);
        }
        var weight = number(record, "weight");
        var releaseDate = number(record, "release_date");

        return new SchedulingJob(id.toString(), processingTime, number(record, "due_date"),
                weight == null ? 1.0 : weight, releaseDate == null ? 0.0 : releaseDate);
    }

    private static Double number(Map<String, ?> record, String key) {
        var value = record.get(key);

        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        var s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            throw new InvalidInputException(key + " must be numeric: " + value, e);
        }
    }
}
