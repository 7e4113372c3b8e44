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
package cz.iocb.resonance.molecule;

import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Relation used to decide whether a newly generated resonance structure duplicates a known one.
 */
public enum EquivalenceMode
{
    ISOMORPHIC
    {
        @Override
        public boolean isEquivalent(IAtomContainer molecule1, IAtomContainer molecule2)
        {
            return Equivalence.isIsomorphic(molecule1, molecule2);
        }
    },

    IDENTICAL
    {
        @Override
        public boolean isEquivalent(IAtomContainer molecule1, IAtomContainer molecule2)
        {
            return Equivalence.isIdentical(molecule1, molecule2);
        }
    };


    public abstract boolean isEquivalent(IAtomContainer molecule1, IAtomContainer molecule2);


    public static EquivalenceMode of(boolean keepIsomorphic)
    {
        return keepIsomorphic ? IDENTICAL : ISOMORPHIC;
    }
}
