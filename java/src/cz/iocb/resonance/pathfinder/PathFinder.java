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

import java.util.ArrayList;
import java.util.List;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import cz.iocb.resonance.molecule.BondOrders;
import cz.iocb.resonance.molecule.Electrons;



/**
 * Finds the delocalization paths starting at a given atom.
 */
public class PathFinder
{
    /**
     * Finds allyl paths atom1-bond12-atom2-bond23-atom3 where atom1 carries a single radical electron, bond12 can
     * gain an order and bond23 can lose one.
     *
     * @param molecule
     * @param atom1 radical centre
     * @return paths with atoms {atom1, atom2, atom3} and bonds {bond12, bond23}
     */
    public static List<DelocalizationPath> findAllDelocalizationPaths(IAtomContainer molecule, IAtom atom1)
    {
        List<DelocalizationPath> paths = new ArrayList<DelocalizationPath>();

        if(Electrons.getRadicalCount(molecule, atom1) != 1)
            return paths;

        for(IBond bond12 : molecule.getConnectedBondsList(atom1))
        {
            if(!BondOrders.isSingle(bond12) && !BondOrders.isDouble(bond12))
                continue;

            IAtom atom2 = bond12.getOther(atom1);

            for(IBond bond23 : molecule.getConnectedBondsList(atom2))
            {
                IAtom atom3 = bond23.getOther(atom2);

                if(atom3.equals(atom1))
                    continue;

                if(BondOrders.isDouble(bond23) || BondOrders.isTriple(bond23))
                {
                    int[] atoms = { molecule.indexOf(atom1), molecule.indexOf(atom2), molecule.indexOf(atom3) };
                    int[] bonds = { molecule.indexOf(bond12), molecule.indexOf(bond23) };
                    paths.add(new DelocalizationPath(atoms, bonds));
                }
            }
        }

        return paths;
    }


    /**
     * Finds paths atom1-bond12-atom2 where a radical on nitrogen or oxygen can swap with a lone pair of a singly
     * bonded nitrogen or oxygen neighbour.
     *
     * @param molecule
     * @param atom1 radical centre
     * @return paths with atoms {atom1, atom2} and bonds {bond12}
     */
    public static List<DelocalizationPath> findAllDelocalizationPathsLonePairRadical(IAtomContainer molecule,
            IAtom atom1)
    {
        List<DelocalizationPath> paths = new ArrayList<DelocalizationPath>();

        if(Electrons.getRadicalCount(molecule, atom1) <= 0)
            return paths;

        int lonePairs1 = Electrons.getLonePairCount(molecule, atom1);

        if(!(Electrons.isNitrogen(atom1) && lonePairs1 == 0 || Electrons.isOxygen(atom1) && lonePairs1 == 2))
            return paths;

        for(IBond bond12 : molecule.getConnectedBondsList(atom1))
        {
            if(!BondOrders.isSingle(bond12))
                continue;

            IAtom atom2 = bond12.getOther(atom1);
            int lonePairs2 = Electrons.getLonePairCount(molecule, atom2);

            if(Electrons.getRadicalCount(molecule, atom2) != 0)
                continue;

            if(Electrons.isNitrogen(atom2) && lonePairs2 == 1 || Electrons.isOxygen(atom2) && lonePairs2 == 3)
            {
                int[] atoms = { molecule.indexOf(atom1), molecule.indexOf(atom2) };
                int[] bonds = { molecule.indexOf(bond12) };
                paths.add(new DelocalizationPath(atoms, bonds));
            }
        }

        return paths;
    }


    /**
     * Finds paths around a hypervalent nitrogen atom1 with two neighbours atom2 and atom3. In the N5dd to N5ts
     * direction both bonds are double and atom3 is a non-radical heteroatom other than oxygen with a lone pair. In
     * the N5ts to N5dd direction bond12 is triple, bond13 is single and atom3 is an anionic nitrogen or oxygen.
     *
     * @param molecule
     * @param atom1 nitrogen atom
     * @return paths with atoms {atom1, atom2, atom3}, bonds {bond12, bond13} and the shift direction
     */
    public static List<DelocalizationPath> findAllDelocalizationPathsN5dd_N5ts(IAtomContainer molecule, IAtom atom1)
    {
        List<DelocalizationPath> paths = new ArrayList<DelocalizationPath>();

        if(!Electrons.isNitrogen(atom1))
            return paths;

        List<IBond> bonds = molecule.getConnectedBondsList(atom1);

        for(IBond bond12 : bonds)
        {
            if(!BondOrders.isDouble(bond12))
                continue;

            for(IBond bond13 : bonds)
            {
                if(bond13.equals(bond12) || !BondOrders.isDouble(bond13))
                    continue;

                IAtom atom3 = bond13.getOther(atom1);

                if(Electrons.getRadicalCount(molecule, atom3) == 0 && Electrons.getLonePairCount(molecule, atom3) > 0
                        && !Electrons.isOxygen(atom3) && !Electrons.isCarbon(atom3))
                    paths.add(createPath(molecule, atom1, bond12, bond13, DelocalizationPath.N5DD_TO_N5TS));
            }
        }

        for(IBond bond12 : bonds)
        {
            if(!BondOrders.isTriple(bond12))
                continue;

            for(IBond bond13 : bonds)
            {
                if(!BondOrders.isSingle(bond13))
                    continue;

                IAtom atom3 = bond13.getOther(atom1);
                int lonePairs3 = Electrons.getLonePairCount(molecule, atom3);

                if(Electrons.isNitrogen(atom3) && lonePairs3 >= 2 || Electrons.isOxygen(atom3) && lonePairs3 >= 3)
                    paths.add(createPath(molecule, atom1, bond12, bond13, DelocalizationPath.N5TS_TO_N5DD));
            }
        }

        return paths;
    }


    private static DelocalizationPath createPath(IAtomContainer molecule, IAtom atom1, IBond bond12, IBond bond13,
            int direction)
    {
        IAtom atom2 = bond12.getOther(atom1);
        IAtom atom3 = bond13.getOther(atom1);

        int[] atoms = { molecule.indexOf(atom1), molecule.indexOf(atom2), molecule.indexOf(atom3) };
        int[] bonds = { molecule.indexOf(bond12), molecule.indexOf(bond13) };

        return new DelocalizationPath(atoms, bonds, direction);
    }
}
