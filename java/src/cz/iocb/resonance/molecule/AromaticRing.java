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

import java.util.Arrays;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;



/**
 * A six-membered carbon ring of a molecule, stored as atom and bond indices so that it can be resolved against any
 * resonance structure of the molecule.
 */
public class AromaticRing
{
    private final int[] atoms;
    private final int[] bonds;


    public AromaticRing(int[] atoms, int[] bonds)
    {
        this.atoms = atoms;
        this.bonds = bonds;
    }


    public int[] getAtoms()
    {
        return atoms;
    }


    public int[] getBonds()
    {
        return bonds;
    }


    public int size()
    {
        return atoms.length;
    }


    public boolean containsAtom(int atom)
    {
        for(int a : atoms)
            if(a == atom)
                return true;

        return false;
    }


    public IBond[] getBonds(IAtomContainer molecule)
    {
        IBond[] result = new IBond[bonds.length];

        for(int i = 0; i < bonds.length; i++)
            result[i] = molecule.getBond(bonds[i]);

        return result;
    }


    public boolean isDelocalized(IAtomContainer molecule)
    {
        for(int bond : bonds)
            if(!BondOrders.isDelocalized(molecule.getBond(bond)))
                return false;

        return true;
    }


    @Override
    public String toString()
    {
        return "ring " + Arrays.toString(atoms);
    }
}
