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
import org.openscience.cdk.interfaces.IBond;



/**
 * Validation of the atom types of a molecule after its bonds or electrons have been reassigned.
 */
public class AtomTypes
{
    /**
     * Checks every atom of the molecule.
     *
     * @param molecule molecule to check
     * @throws AtomTypeException if any atom has an invalid electron assignment
     */
    public static void validate(IAtomContainer molecule) throws AtomTypeException
    {
        for(IAtom atom : molecule.atoms())
            validate(molecule, atom);
    }


    public static boolean isValid(IAtomContainer molecule)
    {
        try
        {
            validate(molecule);
            return true;
        }
        catch(AtomTypeException e)
        {
            return false;
        }
    }


    public static void validate(IAtomContainer molecule, IAtom atom) throws AtomTypeException
    {
        int index = molecule.indexOf(atom);

        int valenceElectrons;
        int capacity;

        try
        {
            valenceElectrons = Electrons.getValenceElectrons(atom);
            capacity = Electrons.getShellCapacity(atom);
        }
        catch(IllegalArgumentException e)
        {
            throw new AtomTypeException(e.getMessage());
        }


        int delocalized = 0;
        int multiple = 0;

        for(IBond bond : molecule.getConnectedBondsList(atom))
        {
            if(!BondOrders.isSupported(bond))
                throw new AtomTypeException("atom " + index + " has a bond of unsupported order " + bond.getOrder());

            if(BondOrders.isDelocalized(bond))
                delocalized++;
            else if(BondOrders.isDouble(bond) || BondOrders.isTriple(bond))
                multiple++;
        }

        if(delocalized == 1 || delocalized > 3)
            throw new AtomTypeException("atom " + index + " has " + delocalized + " benzene bonds");

        if(delocalized > 0 && multiple > 0)
            throw new AtomTypeException("atom " + index + " combines benzene bonds with a multiple bond");


        int valence = Electrons.getValence(molecule, atom);
        int radicals = Electrons.getRadicalCount(molecule, atom);
        int lonePairs = Electrons.getLonePairCount(molecule, atom);
        int charge = Electrons.getCharge(atom);

        if(valenceElectrons - valence - radicals - 2 * lonePairs != charge)
            throw new AtomTypeException("atom " + index + " (" + atom.getSymbol() + ") has charge " + charge
                    + " inconsistent with valence " + valence + ", " + radicals + " radicals and " + lonePairs
                    + " lone pairs");

        if(2 * valence + 2 * lonePairs + radicals > capacity)
            throw new AtomTypeException("atom " + index + " (" + atom.getSymbol() + ") exceeds its valence shell");
    }
}
