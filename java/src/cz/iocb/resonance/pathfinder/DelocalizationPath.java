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
package cz.iocb.resonance.pathfinder;

import java.util.Arrays;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;



/**
 * A chain of atoms and bonds along which electrons can be shifted. Atoms and bonds are kept as indices, so a path
 * found on one structure applies to any copy of it.
 */
public class DelocalizationPath
{
    public static final int N5DD_TO_N5TS = 1;
    public static final int N5TS_TO_N5DD = 2;

    private final int[] atoms;
    private final int[] bonds;
    private final int direction;


    public DelocalizationPath(int[] atoms, int[] bonds)
    {
        this(atoms, bonds, 0);
    }


    public DelocalizationPath(int[] atoms, int[] bonds, int direction)
    {
        this.atoms = atoms;
        this.bonds = bonds;
        this.direction = direction;
    }


    public int getAtomIndex(int position)
    {
        return atoms[position];
    }


    public int getBondIndex(int position)
    {
        return bonds[position];
    }


    public IAtom getAtom(IAtomContainer molecule, int position)
    {
        return molecule.getAtom(atoms[position]);
    }


    public IBond getBond(IAtomContainer molecule, int position)
    {
        return molecule.getBond(bonds[position]);
    }


    public int getAtomCount()
    {
        return atoms.length;
    }


    public int getBondCount()
    {
        return bonds.length;
    }


    public int getDirection()
    {
        return direction;
    }


    @Override
    public String toString()
    {
        return "atoms " + Arrays.toString(atoms) + ", bonds " + Arrays.toString(bonds)
                + (direction != 0 ? ", direction " + direction : "");
    }
}
