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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.Relationship;



/**
 * A maximization problem over binary variables with linear constraints.
 */
public class BinaryProgram
{
    private final double[] objective;
    private final List<LinearConstraint> constraints = new ArrayList<LinearConstraint>();
    private final int[] lowerBounds;
    private final int[] upperBounds;


    public BinaryProgram(double[] objective)
    {
        this.objective = objective.clone();
        this.lowerBounds = new int[objective.length];
        this.upperBounds = new int[objective.length];

        Arrays.fill(upperBounds, 1);
    }


    public void addEquality(double[] coefficients, double value)
    {
        addConstraint(coefficients, Relationship.EQ, value);
    }


    public void addLessOrEqual(double[] coefficients, double value)
    {
        addConstraint(coefficients, Relationship.LEQ, value);
    }


    private void addConstraint(double[] coefficients, Relationship relationship, double value)
    {
        if(coefficients.length != objective.length)
            throw new IllegalArgumentException(
                    "constraint has " + coefficients.length + " coefficients, expected " + objective.length);

        constraints.add(new LinearConstraint(coefficients.clone(), relationship, value));
    }


    /**
     * Pins a variable to a single value.
     *
     * @param variable
     * @param value 0 or 1
     */
    public void fixVariable(int variable, int value)
    {
        if(value != 0 && value != 1)
            throw new IllegalArgumentException("binary variable cannot be fixed to " + value);

        lowerBounds[variable] = value;
        upperBounds[variable] = value;
    }


    public int getVariableCount()
    {
        return objective.length;
    }


    public double[] getObjective()
    {
        return objective;
    }


    public List<LinearConstraint> getConstraints()
    {
        return Collections.unmodifiableList(constraints);
    }


    public int getLowerBound(int variable)
    {
        return lowerBounds[variable];
    }


    public int getUpperBound(int variable)
    {
        return upperBounds[variable];
    }
}
