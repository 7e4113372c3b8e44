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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ListIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.ilp.BinaryProgramSolver;
import cz.iocb.resonance.molecule.ConnectivityLabels;
import cz.iocb.resonance.molecule.Equivalence;
import cz.iocb.resonance.molecule.EquivalenceMode;
import cz.iocb.resonance.molecule.MoleculeFeatures;
import cz.iocb.resonance.molecule.Rings;
import cz.iocb.resonance.shared.ConfigurationProperties;



/**
 * Generator of all resonance structures of a molecule.
 *
 * Most of the work goes into aromatic species, so that the generated set does not depend on the input form:
 * <ul>
 * <li>radical polycyclic aromatics get Kekule structures, radical shifts and Clar structures, and only the aromatic
 * results are kept,</li>
 * <li>radical monocyclic aromatics get radical shifts from their Kekule structures,</li>
 * <li>stable polycyclic aromatics get Clar structures,</li>
 * <li>stable monocyclic aromatics and aryl radicals keep their aromatic form.</li>
 * </ul>
 */
public class ResonanceGenerator
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(ResonanceGenerator.class);

    public static final String CLAR_STRUCTURES = "resonance.clarStructures";
    public static final String KEEP_ISOMORPHIC = "resonance.keepIsomorphic";
    public static final String MAX_ITERATIONS = "ilp.maxIterations";
    public static final String EPSILON = "ilp.epsilon";

    private final boolean clarStructures;
    private final EquivalenceMode equivalenceMode;
    private final ClarOptimizer clarOptimizer;


    public ResonanceGenerator() throws IOException
    {
        this(ConfigurationProperties.getDefault());
    }


    public ResonanceGenerator(ConfigurationProperties properties)
    {
        double epsilon = properties.getDoubleProperty(EPSILON, 1.0E-6);
        int maxIterations = properties.getIntProperty(MAX_ITERATIONS, 10000);

        this.clarStructures = properties.getBooleanProperty(CLAR_STRUCTURES, true);
        this.equivalenceMode = EquivalenceMode.of(properties.getBooleanProperty(KEEP_ISOMORPHIC, false));
        this.clarOptimizer = new ClarOptimizer(new BinaryProgramSolver(maxIterations, epsilon), epsilon);
    }


    public ResonanceGenerator(boolean clarStructures, EquivalenceMode equivalenceMode, ClarOptimizer clarOptimizer)
    {
        this.clarStructures = clarStructures;
        this.equivalenceMode = equivalenceMode;
        this.clarOptimizer = clarOptimizer;
    }


    public ClarOptimizer getClarOptimizer()
    {
        return clarOptimizer;
    }


    public List<IAtomContainer> generateResonanceStructures(IAtomContainer molecule)
            throws CDKException, CloneNotSupportedException
    {
        return generateResonanceStructures(molecule, clarStructures, equivalenceMode);
    }


    /**
     * Generates all resonance structures of the molecule. Connectivity labels are assigned to the molecule if it
     * has none.
     *
     * @param molecule molecule with assigned radical electrons and lone pairs
     * @param clarStructures whether Clar structures are generated for polycyclic aromatics
     * @param mode relation used to remove duplicates
     * @return resonance structures, starting with the input molecule
     * @throws CDKException if ring perception fails
     * @throws CloneNotSupportedException
     */
    public List<IAtomContainer> generateResonanceStructures(IAtomContainer molecule, boolean clarStructures,
            EquivalenceMode mode) throws CDKException, CloneNotSupportedException
    {
        if(!ConnectivityLabels.hasLabels(molecule))
            ConnectivityLabels.assign(molecule);

        List<IAtomContainer> molecules = new ArrayList<IAtomContainer>();
        molecules.add(molecule);

        MoleculeFeatures features = new MoleculeFeatures(molecule);
        LOGGER.debug("molecule features: %s", features);

        List<IAtomContainer> aromatic = new ArrayList<IAtomContainer>();

        /* check for false positives and false negatives of aromaticity perception */
        if(features.isAromatic || features.isCyclic && features.isRadical && !features.isArylRadical)
        {
            aromatic = AromaticResonance.generateAromaticResonanceStructures(molecule, features, this);

            if(aromatic.isEmpty())
            {
                features.isAromatic = false;
                features.isPolycyclicAromatic = false;
            }
        }

        if(!aromatic.isEmpty())
        {
            if(features.isRadical && !features.isArylRadical)
            {
                if(features.isPolycyclicAromatic)
                {
                    if(clarStructures)
                    {
                        saturate(aromatic, Arrays.asList(ResonanceMethod.KEKULE), mode, false);
                        saturate(aromatic, Arrays.asList(ResonanceMethod.ADJACENT), mode, false);
                        saturate(aromatic, Arrays.asList(ResonanceMethod.CLAR), mode, false);

                        /* non-aromatic structures are not important contributors */
                        List<IAtomContainer> filtered = new ArrayList<IAtomContainer>();

                        for(IAtomContainer structure : aromatic)
                            if(Rings.isAromatic(structure))
                                filtered.add(structure);

                        aromatic = filtered;
                    }
                }
                else
                {
                    int i = aromatic.size();
                    saturate(aromatic, Arrays.asList(ResonanceMethod.KEKULE), mode, false);
                    int j = aromatic.size();
                    saturate(aromatic, Arrays.asList(ResonanceMethod.ADJACENT), mode, false);

                    /* kekule structures without the radical delocalized into the ring */
                    aromatic.subList(i, j).clear();
                }
            }
            else if(features.isPolycyclicAromatic)
            {
                if(clarStructures)
                    saturate(aromatic, Arrays.asList(ResonanceMethod.CLAR), mode, false);
            }

            removeFirstEquivalent(aromatic, molecule, mode);
            molecules.addAll(aromatic);
        }

        saturate(molecules, ResonanceMethod.populate(features), mode, false);

        return molecules;
    }


    /**
     * Removes the first structure equivalent to the molecule. The structures are already pairwise distinct, so at
     * most one of them can be equivalent.
     */
    private static void removeFirstEquivalent(List<IAtomContainer> structures, IAtomContainer molecule,
            EquivalenceMode mode)
    {
        for(ListIterator<IAtomContainer> it = structures.listIterator(); it.hasNext();)
        {
            if(mode.isEquivalent(molecule, it.next()))
            {
                it.remove();
                return;
            }
        }
    }


    /**
     * Iteratively generates all resonance structures reachable from the starting structures by the given methods.
     * Each new structure is appended unless an equivalent structure is already present.
     *
     * @param molecules starting structures
     * @param methods resonance methods
     * @param mode relation used to remove duplicates
     * @param copy if true, the starting list is left untouched and a new list is returned; otherwise new structures
     *            are appended to the starting list
     * @return list of all structures
     * @throws CDKException
     * @throws CloneNotSupportedException
     */
    public List<IAtomContainer> saturate(List<IAtomContainer> molecules, List<ResonanceMethod> methods,
            EquivalenceMode mode, boolean copy) throws CDKException, CloneNotSupportedException
    {
        if(copy)
            molecules = new ArrayList<IAtomContainer>(molecules);

        for(int index = 0; index < molecules.size(); index++)
        {
            IAtomContainer molecule = molecules.get(index);
            List<IAtomContainer> candidates = new ArrayList<IAtomContainer>();

            for(ResonanceMethod method : methods)
                candidates.addAll(method.generate(molecule, this));

            for(IAtomContainer candidate : candidates)
                if(!containsEquivalent(molecules, candidate, mode))
                    molecules.add(candidate);
        }

        return molecules;
    }


    private static boolean containsEquivalent(List<IAtomContainer> molecules, IAtomContainer candidate,
            EquivalenceMode mode)
    {
        for(IAtomContainer molecule : molecules)
            if(mode.isEquivalent(molecule, candidate))
                return true;

        return false;
    }


    /**
     * Generates all resonance structures by all methods and collects the generated structures that are isomorphic to
     * an already known one. These are the resonance isomers that differ from a known structure only by the placement
     * of electrons on symmetric positions.
     *
     * @param molecule
     * @return the molecule followed by the isomorphic resonance structures, in the order they were found
     * @throws CDKException
     * @throws CloneNotSupportedException
     */
    public List<IAtomContainer> generateIsomorphicResonanceStructures(IAtomContainer molecule)
            throws CDKException, CloneNotSupportedException
    {
        if(!ConnectivityLabels.hasLabels(molecule))
            ConnectivityLabels.assign(molecule);

        List<IAtomContainer> isomorphic = new ArrayList<IAtomContainer>();
        isomorphic.add(molecule);

        List<IAtomContainer> isomers = new ArrayList<IAtomContainer>();
        isomers.add(molecule);

        List<ResonanceMethod> methods = ResonanceMethod.populate(null);

        for(int index = 0; index < isomers.size(); index++)
        {
            IAtomContainer isomer = isomers.get(index);
            List<IAtomContainer> candidates = new ArrayList<IAtomContainer>();

            for(ResonanceMethod method : methods)
                candidates.addAll(method.generate(isomer, this));

            for(IAtomContainer candidate : candidates)
            {
                boolean known = false;

                for(IAtomContainer structure : isomers)
                {
                    if(Equivalence.isIsomorphic(structure, candidate))
                    {
                        isomorphic.add(candidate);
                        known = true;
                        break;
                    }
                }

                if(!known)
                    isomers.add(candidate);
            }
        }

        return isomorphic;
    }
}
