package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;

class ParallelSolverTest extends AbstractSolverTest {
    @Override
    protected BranchAndBoundSolver newSolver(BoundOracle boundOracle) {
        var solver = new BranchAndBoundSolver(boundOracle);
        solver.setWorkerCount(4);
        return solver;
    }
}
