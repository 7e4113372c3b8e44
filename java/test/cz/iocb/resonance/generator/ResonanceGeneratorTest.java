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
package cz.iocb.resonance.generator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.junit.Test;
import org.openscience.cdk.interfaces.IAtomContainer;
import cz.iocb.resonance.molecule.Electrons;
import cz.iocb.resonance.molecule.Equivalence;
import cz.iocb.resonance.molecule.EquivalenceMode;
import cz.iocb.resonance.molecule.MoleculeFeatures;
import cz.iocb.resonance.molecule.Rings;
import cz.iocb.resonance.shared.ConfigurationProperties;
import cz.iocb.resonance.shared.MoleculeCreator;



public class ResonanceGeneratorTest
{
    private final ResonanceGenerator generator = new ResonanceGenerator(new ConfigurationProperties(new Properties()));


    private static void assertDistinct(List<IAtomContainer> structures, EquivalenceMode mode)
    {
        for(int i = 0; i < structures.size(); i++)
        {
            for(int j = i + 1; j < structures.size(); j++)
            {
                assertFalse("structures " + i + " and " + j,
                        Equivalence.isIdentical(structures.get(i), structures.get(j)));
                assertFalse("structures " + i + " and " + j, mode.isEquivalent(structures.get(i), structures.get(j)));
            }
        }
    }


    private void assertClosed(IAtomContainer molecule, List<IAtomContainer> structures, EquivalenceMode mode)
            throws Exception
    {
        List<ResonanceMethod> methods = ResonanceMethod.populate(new MoleculeFeatures(molecule));

        for(IAtomContainer structure : structures)
        {
            for(ResonanceMethod method : methods)
            {
                for(IAtomContainer candidate : method.generate(structure, generator))
                {
                    boolean known = false;

                    for(IAtomContainer other : structures)
                        if(mode.isEquivalent(other, candidate))
                            known = true;

                    assertTrue(method + " gives a new structure", known);
                }
            }
        }
    }


    private static int countRingRadicals(IAtomContainer structure)
    {
        int count = 0;

        for(int i = 1; i < structure.getAtomCount(); i++)
            count += Electrons.getRadicalCount(structure, structure.getAtom(i));

        return count;
    }


    @Test
    public void radicalIsDelocalizedAlongDoubleBond() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC");
        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);

        assertEquals(2, structures.size());
        assertSame(molecule, structures.get(0));
        assertEquals(1, Electrons.getRadicalCount(structures.get(1), structures.get(1).getAtom(2)));

        List<IAtomContainer> again = generator.generateResonanceStructures(structures.get(1));
        assertEquals(2, again.size());
        assertTrue(Equivalence.isIsomorphic(molecule, again.get(1)));
    }


    @Test
    public void benzeneHasKekuleAndAromaticForm() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("C1=CC=CC=C1");
        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);

        assertEquals(2, structures.size());
        assertSame(molecule, structures.get(0));
        assertTrue(Rings.isAromatic(structures.get(1)));
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);
    }


    @Test
    public void naphthaleneGetsClarStructure() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("C1=CC=C2C=CC=CC2=C1");

        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);
        assertEquals(3, structures.size());
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);

        List<IAtomContainer> withoutClar = generator.generateResonanceStructures(molecule, false,
                EquivalenceMode.ISOMORPHIC);
        assertEquals(2, withoutClar.size());
    }


    @Test
    public void identicalModeKeepsIsomorphicStructures() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=C");

        assertEquals(1, generator.generateResonanceStructures(molecule).size());

        String file = getClass().getClassLoader().getResource("test.properties").getPath();
        ResonanceGenerator keeping = new ResonanceGenerator(new ConfigurationProperties(file));
        List<IAtomContainer> structures = keeping.generateResonanceStructures(molecule);

        assertEquals(2, structures.size());
        assertTrue(Equivalence.isIsomorphic(structures.get(0), structures.get(1)));
        assertDistinct(structures, EquivalenceMode.IDENTICAL);
    }


    @Test
    public void azideGetsTripleBondForm() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("N=[N+]=[N-]");
        IAtomContainer expected = MoleculeCreator.getMoleculeFromSmiles("[NH-][N+]#N");

        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);

        boolean found = false;

        for(IAtomContainer structure : structures)
            if(Equivalence.isIsomorphic(expected, structure))
                found = true;

        assertTrue(found);
    }


    @Test
    public void benzylRadicalIsDelocalizedIntoRing() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C1=CC=CC=C1");
        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);

        /* Kekule input, aromatic form, ortho and para radicals */
        assertEquals(4, structures.size());
        assertSame(molecule, structures.get(0));
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);

        boolean aromatic = false;

        for(IAtomContainer structure : structures)
            if(Rings.isAromatic(structure))
                aromatic = true;

        assertTrue(aromatic);
    }


    @Test
    public void saturateCanLeaveInputUntouched() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC=CC");
        List<IAtomContainer> molecules = new ArrayList<IAtomContainer>();
        molecules.add(molecule);

        List<IAtomContainer> saturated = generator.saturate(molecules, Arrays.asList(ResonanceMethod.ADJACENT),
                EquivalenceMode.ISOMORPHIC, true);

        assertEquals(1, molecules.size());
        assertEquals(3, saturated.size());
        assertSame(molecule, saturated.get(0));

        generator.saturate(molecules, Arrays.asList(ResonanceMethod.ADJACENT), EquivalenceMode.ISOMORPHIC, false);
        assertEquals(3, molecules.size());
    }


    @Test
    public void isomorphicStructuresStartWithInput() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=C");
        List<IAtomContainer> structures = generator.generateIsomorphicResonanceStructures(molecule);

        assertEquals(2, structures.size());
        assertSame(molecule, structures.get(0));
        assertTrue(Equivalence.isIsomorphic(molecule, structures.get(1)));
        assertFalse(Equivalence.isIdentical(molecule, structures.get(1)));
    }


    @Test
    public void radicalChainHasNoDuplicates() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C=CC=CC=C");

        /* terminal and inner radical positions, each with its mirror image */
        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);
        assertEquals(2, structures.size());
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);

        List<IAtomContainer> identical = generator.generateResonanceStructures(molecule, false,
                EquivalenceMode.IDENTICAL);
        assertEquals(4, identical.size());
        assertDistinct(identical, EquivalenceMode.IDENTICAL);

        for(int position = 0; position < 7; position += 2)
        {
            int count = 0;

            for(IAtomContainer structure : identical)
                count += Electrons.getRadicalCount(structure, structure.getAtom(position));

            assertEquals(1, count);
        }
    }


    @Test
    public void repeatedGenerationGivesSameStructures() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C1=CC=CC=C1");

        List<IAtomContainer> first = generator.generateResonanceStructures(molecule);
        List<IAtomContainer> second = generator.generateResonanceStructures(molecule);

        assertEquals(first.size(), second.size());

        for(int i = 0; i < first.size(); i++)
            assertTrue(Equivalence.isIdentical(first.get(i), second.get(i)));
    }


    @Test
    public void structuresAreClosedUnderMethods() throws Exception
    {
        for(String smiles : Arrays.asList("[CH2]C=CC=CC=C", "[CH2]C=CC", "N=[N+]=[N-]", "[O]C=C"))
        {
            IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles(smiles);

            List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);
            assertClosed(molecule, structures, EquivalenceMode.ISOMORPHIC);

            List<IAtomContainer> identical = generator.generateResonanceStructures(molecule, true,
                    EquivalenceMode.IDENTICAL);
            assertClosed(molecule, identical, EquivalenceMode.IDENTICAL);
        }
    }


    @Test
    public void polycyclicRadicalKeepsAromaticStructures() throws Exception
    {
        IAtomContainer molecule = MoleculeCreator.getMoleculeFromSmiles("[CH2]C1=CC=CC2=CC=CC=C12");
        List<IAtomContainer> structures = generator.generateResonanceStructures(molecule);

        assertSame(molecule, structures.get(0));
        assertTrue(structures.size() >= 3);
        assertDistinct(structures, EquivalenceMode.ISOMORPHIC);

        boolean ringRadical = false;
        boolean chainRadical = false;

        for(IAtomContainer structure : structures.subList(1, structures.size()))
        {
            assertTrue(Rings.isAromatic(structure));

            if(countRingRadicals(structure) > 0)
                ringRadical = true;
            else
                chainRadical = true;
        }

        assertTrue(ringRadical);
        assertTrue(chainRadical);

        List<IAtomContainer> withoutClar = generator.generateResonanceStructures(molecule, false,
                EquivalenceMode.ISOMORPHIC);

        assertEquals(2, withoutClar.size());
        assertTrue(Rings.isAromatic(withoutClar.get(1)));
    }
}
