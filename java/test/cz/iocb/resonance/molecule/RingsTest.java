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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import cz.iocb.resonance.shared.MoleculeCreator;



public class RingsTest
{
    private static final String BENZENE = "C1=CC=CC=C1";
    private static final String NAPHTHALENE = "C1=CC=C2C=CC=CC2=C1";


    @Test
    public void sixMemberedCyclesAreFound() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles(NAPHTHALENE);

        assertEquals(2, Rings.getAllSimpleCyclesOfSize(molecule, 6).size());
        assertEquals(2, Rings.getRelevantCyclesOfSize(molecule, 6).size());
        assertEquals(0, Rings.getAllSimpleCyclesOfSize(molecule, 5).size());

        for(int[] cycle : Rings.getAllSimpleCyclesOfSize(molecule, 6))
            assertEquals(6, cycle.length);
    }


    @Test
    public void kekuleRingsArePerceivedAromatic() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles(NAPHTHALENE);
        List<AromaticRing> rings = Rings.getAromaticRings(molecule);

        assertEquals(2, rings.size());
        assertFalse(Rings.isAromatic(molecule));

        for(AromaticRing ring : rings)
            assertEquals(6, ring.getBonds().length);
    }


    @Test
    public void benzeneBondsMakeMoleculeAromatic() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles(BENZENE);

        for(IBond bond : molecule.bonds())
            BondOrders.setDelocalized(bond);

        assertTrue(Rings.isAromatic(molecule));
        assertEquals(1, Rings.getAromaticRings(molecule).size());
        assertTrue(Rings.getAromaticRings(molecule).get(0).isDelocalized(molecule));
    }


    @Test
    public void saturatedAndHeteroatomRingsAreNotAromatic() throws Exception
    {
        assertEquals(0, Rings.getAromaticRings(MoleculeCreator.getMoleculeFromSmiles("C1CCCCC1")).size());
        assertEquals(0, Rings.getAromaticRings(MoleculeCreator.getMoleculeFromSmiles("C1=CC=NC=C1")).size());
    }


    @Test
    public void acyclicMoleculeIsNotCyclic() throws Exception
    {
        assertFalse(Rings.isCyclic(MoleculeCreator.getMoleculeFromSmiles("CC=CC")));
        assertTrue(Rings.isCyclic(MoleculeCreator.getMoleculeFromSmiles("C1CC1")));
    }


    @Test
    public void benzylIsNotArylRadical() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C1=CC=CC=C1");
        List<AromaticRing> rings = Rings.getAromaticRings(molecule);

        assertEquals(1, rings.size());
        assertFalse(Rings.isArylRadical(molecule, rings));
    }


    @Test
    public void radicalOnRingAtomIsArylRadical() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[C]1=CC=CC=C1");

        int[] atoms = { 0, 1, 2, 3, 4, 5 };
        int[] bonds = { 0, 1, 2, 3, 4, 5 };
        AromaticRing ring = new AromaticRing(atoms, bonds);

        assertEquals(1, molecule.getSingleElectronCount());
        assertTrue(Rings.isArylRadical(molecule, Collections.singletonList(ring)));
    }


    @Test
    public void ringDetectionKeepsRingFlags() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles(NAPHTHALENE);

        for(IAtom atom : molecule.atoms())
            atom.setIsInRing(false);

        for(IBond bond : molecule.bonds())
            bond.setIsInRing(false);

        assertTrue(Rings.isCyclic(molecule));
        new MoleculeFeatures(molecule);

        for(IAtom atom : molecule.atoms())
            assertFalse(atom.isInRing());

        for(IBond bond : molecule.bonds())
            assertFalse(bond.isInRing());
    }
}
