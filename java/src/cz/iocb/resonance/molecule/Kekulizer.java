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

import org.openscience.cdk.aromaticity.Kekulization;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;



/**
 * Assigns alternating single and double bonds to the benzene bonds of a molecule.
 */
public class Kekulizer
{
    public static boolean hasDelocalizedBonds(IAtomContainer molecule)
    {
        for(IBond bond : molecule.bonds())
            if(BondOrders.isDelocalized(bond))
                return true;

        return false;
    }


    /**
     * Kekulizes the molecule in place. Aromatic flags are cleared afterwards, so the molecule is left without any
     * benzene bond.
     *
     * @param molecule
     * @throws CDKException if no Kekule structure exists
     */
    public static void kekulize(IAtomContainer molecule) throws CDKException
    {
        for(IAtom atom : molecule.atoms())
        {
            atom.setIsAromatic(false);

            if(atom.getImplicitHydrogenCount() == null)
                atom.setImplicitHydrogenCount(0);

            if(atom.getFormalCharge() == null)
                atom.setFormalCharge(0);
        }

        for(IBond bond : molecule.bonds())
        {
            if(BondOrders.isDelocalized(bond))
            {
                bond.setOrder(IBond.Order.UNSET);

                for(IAtom atom : bond.atoms())
                    atom.setIsAromatic(true);
            }
            else
            {
                bond.setIsAromatic(false);
            }
        }

        Kekulization.kekulize(molecule);

        for(IAtom atom : molecule.atoms())
            atom.setIsAromatic(false);

        for(IBond bond : molecule.bonds())
            bond.setIsAromatic(false);
    }
}
