package com.github.bnbjava.search;

import com.github.bnbjava.bound.BoundOracle;
import com.github.bnbjava.branch.MostConstrained;

class DepthFirstSolverTest extends AbstractSolverTest {
    @Override
    protected BranchAndBoundSolver newSolver(BoundOracle boundOracle) {
        var solver = new BranchAndBoundSolver(boundOracle);
        solver.setSearchOrder(SearchOrder.DEPTH_FIRST);
        solver.setBranchingStrategy(new MostConstrained());
        return solver;
    }
}
