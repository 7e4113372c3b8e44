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

import java.util.List;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.ILonePair;
import org.openscience.cdk.interfaces.ISingleElectron;
import org.openscience.cdk.tools.periodictable.PeriodicTable;



/**
 * Electron bookkeeping of atoms: radical electrons are the single electrons of the container, lone pairs are its
 * lone pairs.
 */
public class Electrons
{
    public static int getRadicalCount(IAtomContainer molecule, IAtom atom)
    {
        return molecule.getConnectedSingleElectronsCount(atom);
    }


    public static int getLonePairCount(IAtomContainer molecule, IAtom atom)
    {
        return molecule.getConnectedLonePairsCount(atom);
    }


    public static int getCharge(IAtom atom)
    {
        Integer charge = atom.getFormalCharge();
        return charge == null ? 0 : charge;
    }


    public static int getImplicitHydrogenCount(IAtom atom)
    {
        Integer count = atom.getImplicitHydrogenCount();
        return count == null ? 0 : count;
    }


    public static void incrementRadical(IAtomContainer molecule, IAtom atom)
    {
        molecule.addSingleElectron(molecule.indexOf(atom));
    }


    public static void decrementRadical(IAtomContainer molecule, IAtom atom)
    {
        List<ISingleElectron> electrons = molecule.getConnectedSingleElectronsList(atom);

        if(electrons.isEmpty())
            throw new IllegalStateException("atom " + molecule.indexOf(atom) + " has no radical electron");

        molecule.removeSingleElectron(electrons.get(0));
    }


    public static void incrementLonePairs(IAtomContainer molecule, IAtom atom)
    {
        molecule.addLonePair(molecule.indexOf(atom));
    }


    public static void decrementLonePairs(IAtomContainer molecule, IAtom atom)
    {
        List<ILonePair> pairs = molecule.getConnectedLonePairsList(atom);

        if(pairs.isEmpty())
            throw new IllegalStateException("atom " + molecule.indexOf(atom) + " has no lone pair");

        molecule.removeLonePair(pairs.get(0));
    }


    /**
     * Counts the valence electrons of the element of the atom.
     *
     * @param atom
     * @return number of valence electrons
     */
    public static int getValenceElectrons(IAtom atom)
    {
        Integer group = PeriodicTable.getGroup(atom.getSymbol());

        if(group == null || group > 2 && group < 13)
            throw new IllegalArgumentException("unsupported element: " + atom.getSymbol());

        return group <= 2 ? group : group - 10;
    }


    public static int getShellCapacity(IAtom atom)
    {
        Integer period = PeriodicTable.getPeriod(atom.getSymbol());

        if(period == null)
            throw new IllegalArgumentException("unsupported element: " + atom.getSymbol());

        if(period == 1)
            return 2;
        else if(period == 2)
            return 8;
        else
            return 12;
    }


    public static int getDelocalizedBondCount(IAtomContainer molecule, IAtom atom)
    {
        int count = 0;

        for(IBond bond : molecule.getConnectedBondsList(atom))
            if(BondOrders.isDelocalized(bond))
                count++;

        return count;
    }


    /**
     * Sums the bond orders of the atom, including bonds to implicit hydrogens. Delocalized bonds count as sigma bonds
     * and the atom adds a single pi electron to the delocalized system, whatever the number of its delocalized bonds.
     *
     * @param molecule
     * @param atom
     * @return valence of the atom
     */
    public static int getValence(IAtomContainer molecule, IAtom atom)
    {
        int valence = getImplicitHydrogenCount(atom);
        boolean delocalized = false;

        for(IBond bond : molecule.getConnectedBondsList(atom))
        {
            if(BondOrders.isDelocalized(bond))
            {
                valence++;
                delocalized = true;
            }
            else
            {
                valence += (int) BondOrders.getValue(bond);
            }
        }

        if(delocalized)
            valence++;

        return valence;
    }


    public static int getExpectedCharge(IAtomContainer molecule, IAtom atom)
    {
        return getValenceElectrons(atom) - getValence(molecule, atom) - getRadicalCount(molecule, atom)
                - 2 * getLonePairCount(molecule, atom);
    }


    public static void updateCharge(IAtomContainer molecule, IAtom atom)
    {
        atom.setFormalCharge(getExpectedCharge(molecule, atom));
    }


    public static boolean isRadical(IAtomContainer molecule)
    {
        return molecule.getSingleElectronCount() > 0;
    }


    public static boolean isHydrogen(IAtom atom)
    {
        return "H".equals(atom.getSymbol());
    }


    public static boolean isCarbon(IAtom atom)
    {
        return "C".equals(atom.getSymbol());
    }


    public static boolean isNitrogen(IAtom atom)
    {
        return "N".equals(atom.getSymbol());
    }


    public static boolean isOxygen(IAtom atom)
    {
        return "O".equals(atom.getSymbol());
    }
}
