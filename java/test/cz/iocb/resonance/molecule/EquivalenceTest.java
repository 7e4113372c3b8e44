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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.shared.MoleculeCreator;



public class EquivalenceTest
{
    private static IAtomContainer shiftRadical(IAtomContainer molecule) throws CloneNotSupportedException
    {
        IAtomContainer shifted = molecule.clone();
        ConnectivityLabels.copy(molecule, shifted);

        Electrons.decrementRadical(shifted, shifted.getAtom(0));
        Electrons.incrementRadical(shifted, shifted.getAtom(2));
        BondOrders.increment(shifted.getBond(0));
        BondOrders.decrement(shifted.getBond(1));

        return shifted;
    }


    @Test
    public void copyIsIdenticalAndIsomorphic() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");
        IAtomContainer copy = molecule.clone();

        assertTrue(Equivalence.isIdentical(molecule, copy));
        assertTrue(Equivalence.isIsomorphic(molecule, copy));
        assertTrue(EquivalenceMode.IDENTICAL.isEquivalent(molecule, copy));
    }


    @Test
    public void symmetricShiftIsIsomorphicButNotIdentical() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=C");
        IAtomContainer shifted = shiftRadical(molecule);

        assertTrue(AtomTypes.isValid(shifted));
        assertTrue(Equivalence.isIsomorphic(molecule, shifted));
        assertFalse(Equivalence.isIdentical(molecule, shifted));
    }


    @Test
    public void asymmetricShiftIsNotIsomorphic() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");
        IAtomContainer shifted = shiftRadical(molecule);

        assertTrue(AtomTypes.isValid(shifted));
        assertFalse(Equivalence.isIsomorphic(molecule, shifted));
        assertFalse(EquivalenceMode.ISOMORPHIC.isEquivalent(molecule, shifted));
    }


    @Test
    public void atomOrderDoesNotMatterForIsomorphism() throws Exception
    {
        IAtomContainer molecule1 = MoleculeCreator.getMoleculeFromSmiles("CC=C");
        IAtomContainer molecule2 = MoleculeCreator.getMoleculeFromSmiles("C=CC");

        assertTrue(Equivalence.isIsomorphic(molecule1, molecule2));
        assertFalse(Equivalence.isIdentical(molecule1, molecule2));
    }


    @Test
    public void chargesAreCompared() throws Exception
    {
        IAtomContainer molecule1 = MoleculeCreator.getMoleculeFromSmiles("C[O-]");
        IAtomContainer molecule2 = MoleculeCreator.getMoleculeFromSmiles("CO");

        assertFalse(Equivalence.isIsomorphic(molecule1, molecule2));
    }


    @Test
    public void modeIsSelectedByKeepIsomorphicFlag()
    {
        assertTrue(EquivalenceMode.of(true) == EquivalenceMode.IDENTICAL);
        assertTrue(EquivalenceMode.of(false) == EquivalenceMode.ISOMORPHIC);
    }


    @Test
    public void structureDerivedFromMatchedTargetIsCompared() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");
        IAtomContainer shifted = shiftRadical(molecule);

        assertFalse(Equivalence.isIsomorphic(molecule, shifted));

        IAtomContainer back = shifted.clone();
        ConnectivityLabels.copy(shifted, back);

        Electrons.decrementRadical(back, back.getAtom(2));
        Electrons.incrementRadical(back, back.getAtom(0));
        BondOrders.decrement(back.getBond(0));
        BondOrders.increment(back.getBond(1));

        assertTrue(Equivalence.isIdentical(molecule, back));
        assertTrue(Equivalence.isIsomorphic(molecule, back));
        assertTrue(Equivalence.isIsomorphic(back, molecule));
        assertFalse(Equivalence.isIsomorphic(shifted, back));
    }
}
