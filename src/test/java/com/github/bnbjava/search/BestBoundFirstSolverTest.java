package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;

class BestBoundFirstSolverTest extends AbstractSolverTest {
    @Override
    protected BranchAndBoundSolver newSolver(BoundOracle boundOracle) {
        return new BranchAndBoundSolver(boundOracle);
    }
}
