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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.molecule.MoleculeFeatures;



/**
 * Methods generating resonance structures of a single structure.
 */
public enum ResonanceMethod
{
    ADJACENT
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return ElectronShift.ADJACENT.generate(molecule);
        }
    },

    LONE_PAIR_RADICAL
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return ElectronShift.LONE_PAIR_RADICAL.generate(molecule);
        }
    },

    N5DD_N5TS
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return ElectronShift.N5DD_N5TS.generate(molecule);
        }
    },

    AROMATIC
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CDKException, CloneNotSupportedException
        {
            return AromaticResonance.generateAromaticResonanceStructures(molecule, null, generator);
        }
    },

    KEKULE
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return AromaticResonance.generateKekuleStructure(molecule);
        }
    },

    OPPOSITE_KEKULE
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return AromaticResonance.generateOppositeKekuleStructure(molecule);
        }
    },

    CLAR
    {
        @Override
        public List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
                throws CloneNotSupportedException
        {
            return generator.getClarOptimizer().generateClarStructures(molecule);
        }
    };


    public abstract List<IAtomContainer> generate(IAtomContainer molecule, ResonanceGenerator generator)
            throws CDKException, CloneNotSupportedException;


    /**
     * Selects the methods relevant for a molecule.
     *
     * @param features features of the molecule, or null to select all methods
     * @return methods in the order they are applied
     */
    public static List<ResonanceMethod> populate(MoleculeFeatures features)
    {
        if(features == null)
            return Arrays.asList(values());

        List<ResonanceMethod> methods = new ArrayList<ResonanceMethod>();

        /* aromatic radicals have been handled by the aromatic methods already */
        if(features.isRadical && !features.isAromatic && !features.isArylRadical)
            methods.add(ADJACENT);

        if(features.hasNitrogen)
            methods.add(N5DD_N5TS);

        if(features.hasLonePairs)
            methods.add(LONE_PAIR_RADICAL);

        return methods;
    }
}
