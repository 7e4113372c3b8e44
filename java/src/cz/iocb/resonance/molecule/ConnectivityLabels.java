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

import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;



/**
 * Connectivity values and sorting labels of atoms. They depend on the connectivity of the molecule only, so they are
 * computed once for an input molecule and copied onto all of its resonance structures.
 */
public class ConnectivityLabels
{
    public static final String CONNECTIVITY1 = "resonance.connectivity1";
    public static final String CONNECTIVITY2 = "resonance.connectivity2";
    public static final String CONNECTIVITY3 = "resonance.connectivity3";
    public static final String SORTING_LABEL = "resonance.sortingLabel";


    public static boolean hasLabels(IAtomContainer molecule)
    {
        for(IAtom atom : molecule.atoms())
            if(atom.getProperty(SORTING_LABEL) == null)
                return false;

        return true;
    }


    public static void assign(IAtomContainer molecule)
    {
        int atomCount = molecule.getAtomCount();

        int[] connectivity1 = new int[atomCount];
        int[] connectivity2 = new int[atomCount];
        int[] connectivity3 = new int[atomCount];

        for(int i = 0; i < atomCount; i++)
            connectivity1[i] = molecule.getConnectedBondsCount(i);

        for(int i = 0; i < atomCount; i++)
            for(IAtom neighbour : molecule.getConnectedAtomsList(molecule.getAtom(i)))
                connectivity2[i] += connectivity1[molecule.indexOf(neighbour)];

        for(int i = 0; i < atomCount; i++)
            for(IAtom neighbour : molecule.getConnectedAtomsList(molecule.getAtom(i)))
                connectivity3[i] += connectivity2[molecule.indexOf(neighbour)];

        for(int i = 0; i < atomCount; i++)
        {
            IAtom atom = molecule.getAtom(i);
            atom.setProperty(CONNECTIVITY1, connectivity1[i]);
            atom.setProperty(CONNECTIVITY2, connectivity2[i]);
            atom.setProperty(CONNECTIVITY3, connectivity3[i]);
            atom.setProperty(SORTING_LABEL, i);
        }
    }


    public static void copy(IAtomContainer source, IAtomContainer target)
    {
        for(int i = 0; i < source.getAtomCount(); i++)
        {
            IAtom from = source.getAtom(i);
            IAtom to = target.getAtom(i);

            to.setProperty(CONNECTIVITY1, from.getProperty(CONNECTIVITY1));
            to.setProperty(CONNECTIVITY2, from.getProperty(CONNECTIVITY2));
            to.setProperty(CONNECTIVITY3, from.getProperty(CONNECTIVITY3));
            to.setProperty(SORTING_LABEL, from.getProperty(SORTING_LABEL));
        }
    }


    /**
     * Compares the connectivity values of two atoms. Atoms without assigned values are considered compatible.
     *
     * @param atom1
     * @param atom2
     * @return false if the atoms surely cannot be mapped onto each other
     */
    public static boolean isCompatible(IAtom atom1, IAtom atom2)
    {
        return equalOrMissing(atom1.getProperty(CONNECTIVITY1), atom2.getProperty(CONNECTIVITY1))
                && equalOrMissing(atom1.getProperty(CONNECTIVITY2), atom2.getProperty(CONNECTIVITY2))
                && equalOrMissing(atom1.getProperty(CONNECTIVITY3), atom2.getProperty(CONNECTIVITY3));
    }


    private static boolean equalOrMissing(Object value1, Object value2)
    {
        return value1 == null || value2 == null || value1.equals(value2);
    }
}
