/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.resonance.ilp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;



/**
 * Branch and bound solver of binary programs. Linear relaxations are solved by the simplex method; the search
 * branches on the most fractional variable and prunes nodes whose relaxation cannot improve the incumbent.
 */
public class BinaryProgramSolver
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(BinaryProgramSolver.class);

    private static class Node
    {
        final int[] lower;
        final int[] upper;


        Node(int[] lower, int[] upper)
        {
            this.lower = lower;
            this.upper = upper;
        }
    }


    private final int maxIterations;
    private final double epsilon;


    public BinaryProgramSolver(int maxIterations, double epsilon)
    {
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
    }


    public BinarySolution solve(BinaryProgram program)
    {
        int count = program.getVariableCount();

        int[] lower = new int[count];
        int[] upper = new int[count];

        for(int i = 0; i < count; i++)
        {
            lower[i] = program.getLowerBound(i);
            upper[i] = program.getUpperBound(i);
        }

        Deque<Node> stack = new ArrayDeque<Node>();
        stack.push(new Node(lower, upper));

        double bestObjective = Double.NEGATIVE_INFINITY;
        double[] bestValues = null;
        int nodes = 0;

        while(!stack.isEmpty())
        {
            Node node = stack.pop();
            nodes++;

            PointValuePair relaxation;

            try
            {
                relaxation = solveRelaxation(program, node);
            }
            catch(NoFeasibleSolutionException e)
            {
                continue;
            }
            catch(TooManyIterationsException e)
            {
                LOGGER.debug("simplex iteration limit %d reached after %d nodes", maxIterations, nodes);
                return BinarySolution.failed(BinarySolution.Status.ITERATION_LIMIT);
            }

            double value = relaxation.getValue();

            if(bestValues != null && value <= bestObjective + epsilon)
                continue;

            double[] point = relaxation.getPoint();
            int branch = getMostFractional(point);

            if(branch < 0)
            {
                bestObjective = value;
                bestValues = point;
                continue;
            }

            int[] zeroUpper = node.upper.clone();
            zeroUpper[branch] = 0;

            int[] oneLower = node.lower.clone();
            oneLower[branch] = 1;

            /* the branch setting the variable to 1 is explored first */
            stack.push(new Node(node.lower, zeroUpper));
            stack.push(new Node(oneLower, node.upper));
        }

        LOGGER.debug("binary program with %d variables solved in %d nodes", count, nodes);

        if(bestValues == null)
            return BinarySolution.failed(BinarySolution.Status.INFEASIBLE);

        return new BinarySolution(BinarySolution.Status.OPTIMAL, bestObjective, bestValues);
    }


    private PointValuePair solveRelaxation(BinaryProgram program, Node node)
    {
        int count = program.getVariableCount();
        List<LinearConstraint> constraints = new ArrayList<LinearConstraint>(program.getConstraints());

        for(int i = 0; i < count; i++)
        {
            double[] coefficients = new double[count];
            coefficients[i] = 1;

            constraints.add(new LinearConstraint(coefficients, Relationship.LEQ, node.upper[i]));

            if(node.lower[i] > 0)
                constraints.add(new LinearConstraint(coefficients, Relationship.GEQ, node.lower[i]));
        }

        SimplexSolver solver = new SimplexSolver();

        return solver.optimize(new MaxIter(maxIterations), new LinearObjectiveFunction(program.getObjective(), 0),
                new LinearConstraintSet(constraints), GoalType.MAXIMIZE, new NonNegativeConstraint(true),
                PivotSelectionRule.BLAND);
    }


    private int getMostFractional(double[] point)
    {
        int result = -1;
        double distance = epsilon;

        for(int i = 0; i < point.length; i++)
        {
            double fraction = Math.abs(point[i] - Math.rint(point[i]));

            if(fraction > distance)
            {
                distance = fraction;
                result = i;
            }
        }

        return result;
    }
}
