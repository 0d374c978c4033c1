package com.github.bnbjava.scheduling;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.Problem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.stream.Stream;

import static com.github.bnbjava.Util.maxScale;
import static com.github.bnbjava.Util.roundBound;
import static com.github.bnbjava.model.Sense.MINIMIZE;

/**
 * <p>
 * Lower bound for a {@link SingleMachineProblem}. The longest run of decided positions from the start of the
 * sequence is simulated exactly; the remaining jobs are then bounded by relaxing their release dates and the
 * positions already decided later in the sequence.
 * </p><p>
 * For weighted completion time, the remaining jobs are bounded by the larger of two relaxations: all of them
 * available when the machine becomes free, where Smith's rule (weighted shortest processing time first) is optimal;
 * and every job completing at its own earliest possible time. For weighted tardiness only the second applies.
 * </p>
 */
public class SequencingBound implements BoundOracle {
    /**
     * Default constructor.
     */
    public SequencingBound() {
    }

    @Override
    public double bound(Problem problem, Assignment assignment) {
        if (!(problem instanceof SingleMachineProblem machine)) {
            throw new IllegalArgumentException("SequencingBound requires a SingleMachineProblem.");
        }
        var jobs = machine.getJobs();
        var size = jobs.size();
        var prefix = 0;

        while (prefix < size && assignment.isDecided(prefix)) {
            prefix++;
        }
        var sequence = new int[prefix];
        var scheduled = new boolean[size];

        for (var k = 0; k < prefix; k++) {
            sequence[k] = assignment.value(k);
            if (scheduled[sequence[k]]) {
                return machine.sense().worst();
            }
            scheduled[sequence[k]] = true;
        }

        var evaluated = machine.evaluate(sequence, prefix);
        if (prefix == size) {
            return evaluated[1]; // exact
        }

        var time = evaluated[0];
        var remaining = new ArrayList<SchedulingJob>();
        for (var j = 0; j < size; j++) {
            if (!scheduled[j]) {
                remaining.add(jobs.get(j));
            }
        }

        var earliest = 0.0;
        for (var job : remaining) {
            earliest += machine.cost(job, Math.max(time, job.releaseDate()) + job.processingTime());
        }

        var relaxed = earliest;
        if (machine.getObjective() == SingleMachineProblem.Objective.WEIGHTED_COMPLETION_TIME) {
            relaxed = Math.max(relaxed, smithsRule(machine, remaining, time));
        }
        return roundBound(evaluated[1] + relaxed, scale(machine), MINIMIZE);
    }

    private static double smithsRule(SingleMachineProblem machine, ArrayList<SchedulingJob> remaining, double time) {
        remaining.sort(Comparator.comparingDouble((SchedulingJob job) -> job.processingTime() / job.weight())
                .thenComparing(SchedulingJob::id));
        var total = 0.0;

        for (var job : remaining) {
            time += job.processingTime();
            total += machine.cost(job, time);
        }
        return total;
    }

    /**
     * Decimal scale of the objective: times have at most <code>t</code> decimals and weights at most <code>w</code>,
     * so completion costs are multiples of <code>10^-(t+w)</code>. Tardiness is a difference of times, with the same
     * scale.
     */
    private static int scale(SingleMachineProblem machine) {
        var jobs = machine.getJobs();
        var t = maxScale(Stream.of(
                        jobs.stream().mapToDouble(SchedulingJob::processingTime),
                        jobs.stream().mapToDouble(SchedulingJob::releaseDate),
                        jobs.stream().filter(job -> job.dueDate() != null).mapToDouble(SchedulingJob::dueDate))
                .flatMapToDouble(times -> times).toArray());
        var w = maxScale(jobs.stream().mapToDouble(SchedulingJob::weight).toArray());

        return t < 0 || w < 0 || t + w > 9 ? -1 : t + w;
    }
}
