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
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.aromaticity.Aromaticity;
import org.openscience.cdk.aromaticity.ElectronDonation;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.ringsearch.RingSearch;



/**
 * Ring perception for resonance structures.
 */
public class Rings
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(Rings.class);

    public static final int AROMATIC_RING_SIZE = 6;

    private static final ThreadLocal<Aromaticity> aromaticity = new ThreadLocal<Aromaticity>()
    {
        @Override
        protected Aromaticity initialValue()
        {
            return new Aromaticity(ElectronDonation.daylight(), Cycles.cdkAromaticSet());
        }
    };


    /**
     * Tests whether the molecule has a ring. Ring flags of the molecule are left untouched.
     *
     * @param molecule
     * @return true if any atom is in a ring
     */
    public static boolean isCyclic(IAtomContainer molecule)
    {
        return new RingSearch(molecule).cyclic().length > 0;
    }


    /**
     * Finds all simple cycles of the given size.
     *
     * @param molecule
     * @param size
     * @return cycles as arrays of atom indices, in the order they are traversed
     * @throws CDKException if the cycle search is intractable
     */
    public static List<int[]> getAllSimpleCyclesOfSize(IAtomContainer molecule, int size) throws CDKException
    {
        return filterPaths(Cycles.all(size).find(molecule).paths(), size);
    }


    /**
     * Finds the relevant cycles of the given size.
     *
     * @param molecule
     * @param size
     * @return cycles as arrays of atom indices
     */
    public static List<int[]> getRelevantCyclesOfSize(IAtomContainer molecule, int size)
    {
        return filterPaths(Cycles.relevant(molecule).paths(), size);
    }


    private static List<int[]> filterPaths(int[][] paths, int size)
    {
        List<int[]> cycles = new ArrayList<int[]>();

        for(int[] path : paths)
        {
            /* closed paths repeat the first atom */
            if(path.length != size + 1)
                continue;

            int[] cycle = new int[size];
            System.arraycopy(path, 0, cycle, 0, size);
            cycles.add(cycle);
        }

        return cycles;
    }


    public static List<AromaticRing> getAromaticRings(IAtomContainer molecule)
    {
        return getAromaticRings(molecule, getRelevantCyclesOfSize(molecule, AROMATIC_RING_SIZE));
    }


    /**
     * Selects the aromatic rings among the given cycles. A ring is aromatic if all its atoms are carbons and all its
     * bonds either are benzene bonds already or are perceived as aromatic on a Kekule form of the molecule.
     *
     * @param molecule
     * @param cycles
     * @return aromatic rings, in the order of the cycles
     */
    public static List<AromaticRing> getAromaticRings(IAtomContainer molecule, List<int[]> cycles)
    {
        List<AromaticRing> rings = new ArrayList<AromaticRing>();

        if(cycles.isEmpty())
            return rings;

        IAtomContainer perceived = perceiveAromaticity(molecule);

        for(int[] cycle : cycles)
        {
            boolean aromatic = true;
            int[] bonds = new int[cycle.length];

            for(int i = 0; i < cycle.length && aromatic; i++)
            {
                IAtom atom1 = molecule.getAtom(cycle[i]);
                IAtom atom2 = molecule.getAtom(cycle[(i + 1) % cycle.length]);

                IBond bond = molecule.getBond(atom1, atom2);

                if(!Electrons.isCarbon(atom1) || bond == null)
                {
                    aromatic = false;
                    break;
                }

                bonds[i] = molecule.indexOf(bond);

                if(BondOrders.isDelocalized(bond))
                    continue;

                if(perceived == null || !perceived.getBond(bonds[i]).isAromatic())
                    aromatic = false;
            }

            if(aromatic)
                rings.add(new AromaticRing(cycle.clone(), bonds));
        }

        return rings;
    }


    /**
     * Tests whether the molecule contains a six-membered carbon ring made of benzene bonds only.
     *
     * @param molecule
     * @return true if the molecule is in an aromatic form
     */
    public static boolean isAromatic(IAtomContainer molecule)
    {
        for(int[] cycle : getRelevantCyclesOfSize(molecule, AROMATIC_RING_SIZE))
        {
            boolean aromatic = true;

            for(int i = 0; i < cycle.length && aromatic; i++)
            {
                IAtom atom1 = molecule.getAtom(cycle[i]);
                IAtom atom2 = molecule.getAtom(cycle[(i + 1) % cycle.length]);
                IBond bond = molecule.getBond(atom1, atom2);

                aromatic = Electrons.isCarbon(atom1) && bond != null && BondOrders.isDelocalized(bond);
            }

            if(aromatic)
                return true;
        }

        return false;
    }


    /**
     * Tests whether all radical electrons of the molecule sit on atoms of the given aromatic rings. Such radicals are
     * orthogonal to the pi system of the rings and do not delocalize into them.
     *
     * @param molecule
     * @param rings aromatic rings of the molecule
     * @return true if the molecule is an aryl radical
     */
    public static boolean isArylRadical(IAtomContainer molecule, List<AromaticRing> rings)
    {
        int total = molecule.getSingleElectronCount();
        int aromatic = 0;

        for(int i = 0; i < molecule.getAtomCount(); i++)
        {
            for(AromaticRing ring : rings)
            {
                if(ring.containsAtom(i))
                {
                    aromatic += Electrons.getRadicalCount(molecule, molecule.getAtom(i));
                    break;
                }
            }
        }

        return total == aromatic;
    }


    private static IAtomContainer perceiveAromaticity(IAtomContainer molecule)
    {
        try
        {
            IAtomContainer clone = molecule.clone();

            if(Kekulizer.hasDelocalizedBonds(clone))
                Kekulizer.kekulize(clone);

            for(IAtom atom : clone.atoms())
            {
                atom.setIsAromatic(false);

                if(atom.getImplicitHydrogenCount() == null)
                    atom.setImplicitHydrogenCount(0);

                if(atom.getFormalCharge() == null)
                    atom.setFormalCharge(0);
            }

            for(IBond bond : clone.bonds())
                bond.setIsAromatic(false);

            aromaticity.get().apply(clone);
            return clone;
        }
        catch(CloneNotSupportedException | CDKException e)
        {
            LOGGER.debug("aromaticity perception failed, using benzene bonds only: %s", e.getMessage());
            return null;
        }
    }
}
