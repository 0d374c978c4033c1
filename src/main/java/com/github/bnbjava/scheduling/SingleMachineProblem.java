package com.github.bnbjava.scheduling;

import com.github.bnbjava.model.AllDifferent;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.InvalidInputException;
import com.github.bnbjava.model.Problem;
import com.github.bnbjava.model.Sense;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Sequencing jobs on a single machine, with release dates, to minimize either the total weighted completion time
 * (<code>1|r_j|sum w_j C_j</code>) or the total weighted tardiness (<code>1|r_j|sum w_j T_j</code>.)
 * </p><p>
 * Variable <code>k</code> is the index of the job processed in position <code>k</code>; all variables share the
 * domain <code>0..n-1</code> and must take different values. A job never starts before its release date, so the
 * machine may be idle between jobs.
 * </p>
 *
 * @see SequencingBound
 */
public class SingleMachineProblem implements Problem {
    /**
     * The scheduling objective.
     */
    public enum Objective {
        /**
         * Sum of weight times completion time.
         */
        WEIGHTED_COMPLETION_TIME,
        /**
         * Sum of weight times lateness past the due date. Jobs without a due date are never tardy.
         */
        WEIGHTED_TARDINESS
    }

    private final List<SchedulingJob> jobs;
    private final Objective objective;

    /**
     * Constructor.
     *
     * @param jobs      the jobs, with distinct ids
     * @param objective what to minimize
     * @throws InvalidInputException if ids are not distinct
     */
    public SingleMachineProblem(List<SchedulingJob> jobs, Objective objective) {
        if (objective == null) {
            throw new InvalidInputException("objective must not be null.");
        }
        var ids = new HashSet<String>();

        for (var job : jobs) {
            if (!ids.add(job.id())) {
                throw new InvalidInputException("duplicate job id " + job.id());
            }
        }
        this.jobs = List.copyOf(jobs);
        this.objective = objective;
    }

    /**
     * Minimize the total weighted completion time.
     *
     * @param jobs the jobs, with distinct ids
     */
    public SingleMachineProblem(List<SchedulingJob> jobs) {
        this(jobs, Objective.WEIGHTED_COMPLETION_TIME);
    }

    /**
     * Build a problem from tabular records.
     *
     * @param records   one record per job; see {@link SchedulingJob#fromRecord(Map)}
     * @param objective what to minimize
     * @return the problem
     */
    public static SingleMachineProblem fromRecords(List<? extends Map<String, ?>> records, Objective objective) {
        return new SingleMachineProblem(records.stream().<SchedulingJob>map(SchedulingJob::fromRecord).toList(),
                objective);
    }

    @Override
    public int size() {
        return jobs.size();
    }

    @Override
    public int[] domain(int variable) {
        return AllDifferent.identity(jobs.size());
    }

    @Override
    public Sense sense() {
        return Sense.MINIMIZE;
    }

    @Override
    public boolean isFeasible(Assignment assignment) {
        return AllDifferent.isConsistent(assignment);
    }

    @Override
    public double objective(Assignment assignment) {
        var sequence = assignment.values();
        return evaluate(sequence, sequence.length)[1];
    }

    /**
     * Simulate the first <code>count</code> positions of a sequence.
     *
     * @return a two-element array: the completion time of the last job, and the objective over those jobs
     */
    double[] evaluate(int[] sequence, int count) {
        var time = 0.0;
        var total = 0.0;

        for (var k = 0; k < count; k++) {
            var job = jobs.get(sequence[k]);
            time = Math.max(time, job.releaseDate()) + job.processingTime();
            total += cost(job, time);
        }
        return new double[]{time, total};
    }

    /**
     * The objective contribution of a job completing at <code>finish</code>.
     */
    double cost(SchedulingJob job, double finish) {
        if (objective == Objective.WEIGHTED_COMPLETION_TIME) {
            return job.weight() * finish;
        }
        return job.dueDate() == null ? 0.0 : job.weight() * Math.max(0.0, finish - job.dueDate());
    }

    /**
     * Build the machine timeline of a sequence.
     *
     * @param sequence job indices in processing order
     * @return one entry per job, in processing order
     */
    public List<ScheduledJob> schedule(int[] sequence) {
        var timeline = new ArrayList<ScheduledJob>(sequence.length);
        var time = 0.0;

        for (var k = 0; k < sequence.length; k++) {
            var job = jobs.get(sequence[k]);
            var start = Math.max(time, job.releaseDate());
            var finish = start + job.processingTime();

            timeline.add(new ScheduledJob(k, sequence[k], job.id(), start, finish, start - time));
            time = finish;
        }
        return timeline;
    }

    /**
     * @return the jobs, in index order
     */
    public List<SchedulingJob> getJobs() {
        return jobs;
    }

    /**
     * @return the scheduling objective
     */
    public Objective getObjective() {
        return objective;
    }
}
