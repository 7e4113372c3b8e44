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
import cz.iocb.resonance.shared.MoleculeCreator;



public class MoleculeFeaturesTest
{
    @Test
    public void radicalChainFeatures() throws Exception
    {
        MoleculeFeatures features = new MoleculeFeatures(MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC"));

        assertTrue(features.isRadical);
        assertFalse(features.isCyclic);
        assertFalse(features.isAromatic);
        assertFalse(features.hasNitrogen);
        assertFalse(features.hasLonePairs);
    }


    @Test
    public void polycyclicAromaticFeatures() throws Exception
    {
        MoleculeFeatures features = new MoleculeFeatures(
                MoleculeCreator.getMoleculeFromSmiles("C1=CC=C2C=CC=CC2=C1"));

        assertFalse(features.isRadical);
        assertTrue(features.isCyclic);
        assertTrue(features.isAromatic);
        assertTrue(features.isPolycyclicAromatic);
        assertFalse(features.isArylRadical);
    }


    @Test
    public void heteroatomFeatures() throws Exception
    {
        MoleculeFeatures features = new MoleculeFeatures(MoleculeCreator.getMoleculeFromSmiles("NCC=O"));

        assertTrue(features.hasNitrogen);
        assertTrue(features.hasOxygen);
        assertTrue(features.hasLonePairs);
    }


    @Test
    public void benzylRadicalFeatures() throws Exception
    {
        MoleculeFeatures features = new MoleculeFeatures(MoleculeCreator.getMoleculeFromSmiles("[CH2]C1=CC=CC=C1"));

        assertTrue(features.isRadical);
        assertTrue(features.isAromatic);
        assertFalse(features.isPolycyclicAromatic);
        assertFalse(features.isArylRadical);
    }
}
