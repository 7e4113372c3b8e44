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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.List;
import org.junit.Test;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.shared.MoleculeCreator;



public class PathFinderTest
{
    @Test
    public void allylPathStartsAtRadical() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");

        List<DelocalizationPath> paths = PathFinder.findAllDelocalizationPaths(molecule, molecule.getAtom(0));

        assertEquals(1, paths.size());
        assertEquals(0, paths.get(0).getAtomIndex(0));
        assertEquals(1, paths.get(0).getAtomIndex(1));
        assertEquals(2, paths.get(0).getAtomIndex(2));
        assertEquals(0, paths.get(0).getBondIndex(0));
        assertEquals(1, paths.get(0).getBondIndex(1));
    }


    @Test
    public void nonRadicalAtomHasNoAllylPath() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");

        for(int i = 1; i < molecule.getAtomCount(); i++)
            assertTrue(PathFinder.findAllDelocalizationPaths(molecule, molecule.getAtom(i)).isEmpty());
    }


    @Test
    public void allylPathFollowsTripleBond() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C#C");

        assertEquals(1, PathFinder.findAllDelocalizationPaths(molecule, molecule.getAtom(0)).size());
    }


    @Test
    public void radicalSwapsWithLonePairOfAnionicOxygen() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[O][O-]");

        List<DelocalizationPath> paths = PathFinder.findAllDelocalizationPathsLonePairRadical(molecule,
                molecule.getAtom(0));

        assertEquals(1, paths.size());
        assertEquals(1, paths.get(0).getAtomIndex(1));
        assertTrue(PathFinder.findAllDelocalizationPathsLonePairRadical(molecule, molecule.getAtom(1)).isEmpty());
    }


    @Test
    public void neutralOxygenHasNoLonePairRadicalPath() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[O]O");

        assertTrue(PathFinder.findAllDelocalizationPathsLonePairRadical(molecule, molecule.getAtom(0)).isEmpty());
    }


    @Test
    public void azideHasBothN5ddPaths() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("N=[N+]=[N-]");

        List<DelocalizationPath> paths = PathFinder.findAllDelocalizationPathsN5dd_N5ts(molecule, molecule.getAtom(1));

        assertEquals(2, paths.size());

        for(DelocalizationPath path : paths)
        {
            assertEquals(DelocalizationPath.N5DD_TO_N5TS, path.getDirection());
            assertEquals(1, path.getAtomIndex(0));
        }

        assertTrue(PathFinder.findAllDelocalizationPathsN5dd_N5ts(molecule, molecule.getAtom(0)).isEmpty());
    }


    @Test
    public void n5tsPathNeedsAnionicNeighbour() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[NH-][N+]#N");

        List<DelocalizationPath> paths = PathFinder.findAllDelocalizationPathsN5dd_N5ts(molecule, molecule.getAtom(1));

        assertEquals(1, paths.size());
        assertEquals(DelocalizationPath.N5TS_TO_N5DD, paths.get(0).getDirection());
        assertEquals(2, paths.get(0).getAtomIndex(1));
        assertEquals(0, paths.get(0).getAtomIndex(2));
    }


    @Test
    public void nitrogenOnlyPaths() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("C=C=C");

        for(int i = 0; i < molecule.getAtomCount(); i++)
            assertTrue(PathFinder.findAllDelocalizationPathsN5dd_N5ts(molecule, molecule.getAtom(i)).isEmpty());
    }
}
