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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.isomorphism.AtomMatcher;
import org.openscience.cdk.isomorphism.BondMatcher;
import org.openscience.cdk.isomorphism.VentoFoggia;



/**
 * Equivalence relations between resonance structures of the same molecule.
 */
public class Equivalence
{
    /**
     * Tests whether two structures are isomorphic. Atoms match when they agree in element, formal charge, implicit
     * hydrogens, radical electrons, lone pairs and connectivity values; bonds match when they have the same order.
     *
     * @param molecule1
     * @param molecule2
     * @return true if a mapping of the first structure onto the second exists
     */
    public static boolean isIsomorphic(final IAtomContainer molecule1, final IAtomContainer molecule2)
    {
        if(molecule1.getAtomCount() != molecule2.getAtomCount())
            return false;

        if(molecule1.getBondCount() != molecule2.getBondCount())
            return false;

        if(molecule1.getSingleElectronCount() != molecule2.getSingleElectronCount())
            return false;

        if(molecule1.getLonePairCount() != molecule2.getLonePairCount())
            return false;


        AtomMatcher atomMatcher = new AtomMatcher()
        {
            @Override
            public boolean matches(IAtom atom1, IAtom atom2)
            {
                return atom1.getAtomicNumber().equals(atom2.getAtomicNumber())
                        && Electrons.getCharge(atom1) == Electrons.getCharge(atom2)
                        && Electrons.getImplicitHydrogenCount(atom1) == Electrons.getImplicitHydrogenCount(atom2)
                        && Electrons.getRadicalCount(molecule1, atom1) == Electrons.getRadicalCount(molecule2, atom2)
                        && Electrons.getLonePairCount(molecule1, atom1) == Electrons.getLonePairCount(molecule2, atom2)
                        && ConnectivityLabels.isCompatible(atom1, atom2);
            }
        };

        BondMatcher bondMatcher = new BondMatcher()
        {
            @Override
            public boolean matches(IBond bond1, IBond bond2)
            {
                return BondOrders.getValue(bond1) == BondOrders.getValue(bond2);
            }
        };

        clearMatchingCache(molecule1);
        clearMatchingCache(molecule2);

        return VentoFoggia.findIdentical(molecule1, atomMatcher, bondMatcher).matches(molecule2);
    }


    /**
     * Removes the adjacency cache that the matcher stores as a property of its target. The cache is copied by
     * {@link IAtomContainer#clone()} and then refers to the bonds of the original container, so a structure derived
     * from a former target would be matched with the bond orders of its parent.
     *
     * @param molecule
     */
    public static void clearMatchingCache(IAtomContainer molecule)
    {
        String prefix = VentoFoggia.class.getName();
        List<Object> keys = new ArrayList<Object>();

        for(Object key : molecule.getProperties().keySet())
            if(key instanceof String && ((String) key).startsWith(prefix))
                keys.add(key);

        for(Object key : keys)
            molecule.removeProperty(key);
    }


    /**
     * Tests whether two structures of the same molecule carry exactly the same electronic assignment, atom by atom
     * and bond by bond.
     *
     * @param molecule1
     * @param molecule2
     * @return true if the structures are identical
     */
    public static boolean isIdentical(IAtomContainer molecule1, IAtomContainer molecule2)
    {
        if(molecule1.getAtomCount() != molecule2.getAtomCount())
            return false;

        if(molecule1.getBondCount() != molecule2.getBondCount())
            return false;

        return Arrays.equals(getAtomDescriptor(molecule1), getAtomDescriptor(molecule2))
                && Arrays.equals(getBondDescriptor(molecule1), getBondDescriptor(molecule2));
    }


    private static int[] getAtomDescriptor(IAtomContainer molecule)
    {
        int atomCount = molecule.getAtomCount();
        int[] descriptor = new int[5 * atomCount];

        for(int i = 0; i < atomCount; i++)
        {
            IAtom atom = molecule.getAtom(i);

            descriptor[5 * i] = atom.getAtomicNumber();
            descriptor[5 * i + 1] = Electrons.getCharge(atom);
            descriptor[5 * i + 2] = Electrons.getImplicitHydrogenCount(atom);
            descriptor[5 * i + 3] = Electrons.getRadicalCount(molecule, atom);
            descriptor[5 * i + 4] = Electrons.getLonePairCount(molecule, atom);
        }

        return descriptor;
    }


    private static int[] getBondDescriptor(IAtomContainer molecule)
    {
        int bondCount = molecule.getBondCount();
        int[] descriptor = new int[3 * bondCount];

        for(int i = 0; i < bondCount; i++)
        {
            IBond bond = molecule.getBond(i);

            descriptor[3 * i] = molecule.indexOf(bond.getBegin());
            descriptor[3 * i + 1] = molecule.indexOf(bond.getEnd());

            /* doubled so that benzene bonds stay integral */
            descriptor[3 * i + 2] = (int) (2 * BondOrders.getValue(bond));
        }

        return descriptor;
    }
}
