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
package cz.iocb.resonance.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;
import cz.iocb.resonance.ilp.BinaryProgram;
import cz.iocb.resonance.ilp.BinaryProgramSolver;
import cz.iocb.resonance.ilp.BinarySolution;
import cz.iocb.resonance.ilp.ILPSolutionException;
import cz.iocb.resonance.molecule.AromaticRing;
import cz.iocb.resonance.molecule.AtomTypeException;
import cz.iocb.resonance.molecule.AtomTypes;
import cz.iocb.resonance.molecule.BondOrders;
import cz.iocb.resonance.molecule.ConnectivityLabels;
import cz.iocb.resonance.molecule.Electrons;
import cz.iocb.resonance.molecule.Rings;



/**
 * Generates Clar structures, i.e. the structures with the maximal number of aromatic sextets.
 *
 * The number of sextets is maximized by a binary program (Hansen, P.; Zheng, M. The Clar Number of a Benzenoid
 * Hydrocarbon and Linear Programming. J. Math. Chem. 1994, 15 (1), 93-107). There is one variable per aromatic
 * ring, set if the ring is a sextet, and one variable per bond of the ring atoms, set if the bond is double. Every
 * ring atom belongs either to exactly one sextet or to exactly one double bond. All optimal solutions are enumerated
 * by repeatedly forbidding the set of sextets of the last solution.
 */
public class ClarOptimizer
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(ClarOptimizer.class);


    public static class ClarModel
    {
        private final List<AromaticRing> rings;
        private final int[] atoms;
        private final int[] bonds;
        private final int[] fixedValues;
        private final double[][] incidence;


        private ClarModel(List<AromaticRing> rings, int[] atoms, int[] bonds, int[] fixedValues,
                double[][] incidence)
        {
            this.rings = rings;
            this.atoms = atoms;
            this.bonds = bonds;
            this.fixedValues = fixedValues;
            this.incidence = incidence;
        }


        public List<AromaticRing> getRings()
        {
            return rings;
        }


        public int[] getAtoms()
        {
            return atoms;
        }


        public int[] getBonds()
        {
            return bonds;
        }


        /**
         * @return the value of an exocyclic bond variable, or -1 for a free variable
         */
        public int getFixedValue(int bond)
        {
            return fixedValues[bond];
        }


        /**
         * @param position position of the atom in {@link #getAtoms()}
         * @return row of the atom constraint marking the rings and bonds the atom belongs to
         */
        public double[] getIncidence(int position)
        {
            return incidence[position];
        }


        public int getVariableCount()
        {
            return rings.size() + bonds.length;
        }
    }


    private final BinaryProgramSolver solver;
    private final double epsilon;


    public ClarOptimizer(BinaryProgramSolver solver, double epsilon)
    {
        this.solver = solver;
        this.epsilon = epsilon;
    }


    /**
     * Generates the Clar structures of the molecule. Structures that are not valid are dropped.
     *
     * @param molecule
     * @return Clar structures, or an empty list if the molecule has no sextet or the optimization fails
     * @throws CloneNotSupportedException
     */
    public List<IAtomContainer> generateClarStructures(IAtomContainer molecule) throws CloneNotSupportedException
    {
        List<IAtomContainer> result = new ArrayList<IAtomContainer>();

        if(!Rings.isCyclic(molecule))
            return result;

        ClarModel model = buildModel(molecule);

        if(model == null)
            return result;

        List<double[]> solutions;

        try
        {
            solutions = optimize(model);
        }
        catch(ILPSolutionException e)
        {
            LOGGER.warn("cannot complete Clar optimization: %s", e.getMessage());
            return result;
        }

        for(double[] solution : solutions)
        {
            IAtomContainer structure = applySolution(molecule, model, solution);

            try
            {
                AtomTypes.validate(structure);
                result.add(structure);
            }
            catch(AtomTypeException e)
            {
                LOGGER.debug("Clar structure dropped: %s", e.getMessage());
            }
        }

        return result;
    }


    /**
     * Builds the optimization model of the molecule.
     *
     * @param molecule
     * @return the model, or null if the molecule has no aromatic ring
     */
    public static ClarModel buildModel(IAtomContainer molecule)
    {
        List<AromaticRing> rings = Rings.getAromaticRings(molecule);

        if(rings.isEmpty())
            return null;

        Set<Integer> atomSet = new LinkedHashSet<Integer>();

        for(AromaticRing ring : rings)
            for(int atom : ring.getAtoms())
                atomSet.add(atom);

        Set<Integer> bondSet = new LinkedHashSet<Integer>();

        for(int atom : atomSet)
        {
            IAtom ringAtom = molecule.getAtom(atom);

            for(IBond bond : molecule.getConnectedBondsList(ringAtom))
                if(!Electrons.isHydrogen(bond.getOther(ringAtom)))
                    bondSet.add(molecule.indexOf(bond));
        }

        int[] atoms = toArray(atomSet);
        int[] bonds = toArray(bondSet);
        int[] fixedValues = new int[bonds.length];

        for(int i = 0; i < bonds.length; i++)
        {
            IBond bond = molecule.getBond(bonds[i]);

            boolean exocyclic = !atomSet.contains(molecule.indexOf(bond.getBegin()))
                    || !atomSet.contains(molecule.indexOf(bond.getEnd()));

            if(exocyclic)
                fixedValues[i] = BondOrders.isDouble(bond) ? 1 : 0;
            else
                fixedValues[i] = -1;
        }

        double[][] incidence = new double[atoms.length][rings.size() + bonds.length];

        for(int a = 0; a < atoms.length; a++)
        {
            IAtom atom = molecule.getAtom(atoms[a]);

            for(int r = 0; r < rings.size(); r++)
                if(rings.get(r).containsAtom(atoms[a]))
                    incidence[a][r] = 1;

            for(int b = 0; b < bonds.length; b++)
                if(molecule.getBond(bonds[b]).contains(atom))
                    incidence[a][rings.size() + b] = 1;
        }

        return new ClarModel(rings, atoms, bonds, fixedValues, incidence);
    }


    /**
     * Finds all solutions with the maximal number of sextets. The first solve must succeed; a failure of a later
     * solve ends the enumeration with the solutions found so far.
     *
     * @param model
     * @return solutions, the last found first
     * @throws ILPSolutionException if the first solve fails
     */
    public List<double[]> optimize(ClarModel model) throws ILPSolutionException
    {
        BinaryProgram program = createProgram(model);
        Deque<double[]> solutions = new ArrayDeque<double[]>();
        double maxNum = Double.NaN;

        while(true)
        {
            BinarySolution solution = solver.solve(program);

            try
            {
                checkSolution(solution, maxNum);
            }
            catch(ILPSolutionException e)
            {
                if(Double.isNaN(maxNum))
                    throw e;

                LOGGER.debug("Clar enumeration stopped after %d solutions: %s", solutions.size(), e.getMessage());
                break;
            }

            if(solution.getObjective() < epsilon)
                break;

            if(Double.isNaN(maxNum))
                maxNum = solution.getObjective();

            double[] values = solution.getValues();
            solutions.push(values);

            /* forbid the same set of sextets */
            double[] cut = new double[model.getVariableCount()];
            double sextets = 0;

            for(int i = 0; i < model.getRings().size(); i++)
            {
                cut[i] = Math.rint(values[i]);
                sextets += cut[i];
            }

            program.addLessOrEqual(cut, sextets - 1);
        }

        return new ArrayList<double[]>(solutions);
    }


    private void checkSolution(BinarySolution solution, double maxNum) throws ILPSolutionException
    {
        if(solution.getStatus() != BinarySolution.Status.OPTIMAL)
            throw new ILPSolutionException("optimization could not find a valid solution: " + solution.getStatus());

        /* no sextet at all is not a failure */
        if(solution.getObjective() < epsilon)
            return;

        if(!Double.isNaN(maxNum) && solution.getObjective() < maxNum - epsilon)
            throw new ILPSolutionException("optimization obtained a sub-optimal solution");

        for(double value : solution.getValues())
            if(Math.abs(value - Math.rint(value)) > epsilon)
                throw new ILPSolutionException("optimization obtained a non-integer solution");
    }


    private static BinaryProgram createProgram(ClarModel model)
    {
        int ringCount = model.getRings().size();
        int count = model.getVariableCount();

        double[] objective = new double[count];

        for(int i = 0; i < ringCount; i++)
            objective[i] = 1;

        BinaryProgram program = new BinaryProgram(objective);

        for(int a = 0; a < model.getAtoms().length; a++)
            program.addEquality(model.getIncidence(a), 1);

        for(int i = 0; i < model.getBonds().length; i++)
            if(model.getFixedValue(i) >= 0)
                program.fixVariable(ringCount + i, model.getFixedValue(i));

        return program;
    }


    private static IAtomContainer applySolution(IAtomContainer molecule, ClarModel model, double[] solution)
            throws CloneNotSupportedException
    {
        IAtomContainer structure = molecule.clone();
        ConnectivityLabels.copy(molecule, structure);

        int ringCount = model.getRings().size();

        /* double bonds first, exocyclic bonds keep their orders */
        for(int b = 0; b < model.getBonds().length; b++)
        {
            if(model.getFixedValue(b) >= 0)
                continue;

            IBond bond = structure.getBond(model.getBonds()[b]);
            BondOrders.setOrder(bond, Math.rint(solution[ringCount + b]) == 1 ? Order.DOUBLE : Order.SINGLE);
        }

        /* then sextets */
        for(int r = 0; r < ringCount; r++)
            if(Math.rint(solution[r]) == 1)
                for(IBond bond : model.getRings().get(r).getBonds(structure))
                    BondOrders.setDelocalized(bond);

        return structure;
    }


    private static int[] toArray(Set<Integer> set)
    {
        int[] array = new int[set.size()];
        int i = 0;

        for(int value : set)
            array[i++] = value;

        return array;
    }
}
