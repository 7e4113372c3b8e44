/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 * Copyright (C) 2008-2009 Mark Rijnbeek    markr@ebi.ac.uk
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
package cz.iocb.resonance.shared;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedList;
import org.openscience.cdk.atomtype.CDKAtomTypeMatcher;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IAtomType;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IChemObjectBuilder;
import org.openscience.cdk.interfaces.IIsotope;
import org.openscience.cdk.interfaces.IPseudoAtom;
import org.openscience.cdk.io.DefaultChemObjectReader;
import org.openscience.cdk.io.MDLV2000Reader;
import org.openscience.cdk.io.MDLV3000Reader;
import org.openscience.cdk.silent.AtomContainer;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.cdk.tools.CDKHydrogenAdder;
import org.openscience.cdk.tools.manipulator.AtomTypeManipulator;
import org.openscience.cdk.tools.periodictable.PeriodicTable;
import cz.iocb.resonance.molecule.BondOrders;
import cz.iocb.resonance.molecule.ConnectivityLabels;
import cz.iocb.resonance.molecule.Electrons;



/**
 * Class for creating molecules with perceived radical electrons and lone pairs
 */
public class MoleculeCreator
{
    /**
     * Creates a molecule using an MDL string and an MDL reader.
     *
     * @param mol
     * @return configured molecule
     * @throws CDKException
     * @throws IOException
     */
    public static IAtomContainer getMoleculeFromMolfile(String mol) throws CDKException, IOException
    {
        DefaultChemObjectReader mdlReader = null;

        if(mol.contains("M  V30 BEGIN CTAB"))
            mdlReader = new MDLV3000Reader();
        else
            mdlReader = new MDLV2000Reader();

        IAtomContainer readMolecule = new AtomContainer();
        mdlReader.setReader(new StringReader(mol));

        readMolecule = mdlReader.read(readMolecule);
        mdlReader.close();


        /* fix deuterium and tritium pseudo atoms */
        LinkedList<IAtom> pseudoHydrogens = new LinkedList<IAtom>();

        for(IAtom atom : readMolecule.atoms())
            if(atom instanceof IPseudoAtom && (atom.getSymbol().equals("D") || atom.getSymbol().equals("T")))
                pseudoHydrogens.add(atom);

        IChemObjectBuilder builder = readMolecule.getBuilder();

        for(IAtom atom : pseudoHydrogens)
        {
            IIsotope isotope = builder.newInstance(IIsotope.class, "H", atom.getSymbol().equals("D") ? 2 : 3);
            IAtom hydrogen = builder.newInstance(IAtom.class, isotope);
            hydrogen.setImplicitHydrogenCount(0);
            readMolecule.addAtom(hydrogen);

            for(IBond bond : readMolecule.bonds())
            {
                if(bond.contains(atom))
                {
                    IAtom other = bond.getOther(atom);
                    IAtom[] atoms = { other, hydrogen };
                    bond.setAtoms(atoms);
                }
            }

            readMolecule.removeAtom(atom);
        }


        CDKAtomTypeMatcher matcher = CDKAtomTypeMatcher.getInstance(readMolecule.getBuilder());

        for(IAtom atom : readMolecule.atoms())
        {
            if(atom.getImplicitHydrogenCount() == null)
            {
                IAtomType type = matcher.findMatchingAtomType(readMolecule, atom);
                AtomTypeManipulator.configure(atom, type);
                CDKHydrogenAdder adder = CDKHydrogenAdder.getInstance(readMolecule.getBuilder());
                adder.addImplicitHydrogens(readMolecule, atom);
            }
        }

        configureMolecule(readMolecule);
        return readMolecule;
    }


    /**
     * Creates a molecule from a SMILES string. Aromatic SMILES are kekulized; radical centres are recognized by their
     * hydrogen deficiency, so radicals are written as bracket atoms with explicit hydrogen counts, e.g. [CH2]C=C.
     *
     * @param smiles
     * @return configured molecule
     * @throws CDKException
     */
    public static IAtomContainer getMoleculeFromSmiles(String smiles) throws CDKException
    {
        SmilesParser sp = new SmilesParser(SilentChemObjectBuilder.getInstance());
        IAtomContainer molecule = sp.parseSmiles(smiles);

        configureMolecule(molecule);
        return molecule;
    }


    /**
     * Prepares a molecule for resonance structure generation: aromaticity flags left over from parsing are dropped
     * from bonds that have an explicit order, radical electrons and lone pairs are assigned, and connectivity labels
     * are computed.
     *
     * @param molecule
     * @throws CDKException if electrons cannot be assigned consistently
     */
    public static void configureMolecule(IAtomContainer molecule) throws CDKException
    {
        for(IAtom atom : molecule.atoms())
        {
            if(atom.getAtomicNumber() == null)
                atom.setAtomicNumber(PeriodicTable.getAtomicNumber(atom.getSymbol()));

            if(atom.getImplicitHydrogenCount() == null)
                atom.setImplicitHydrogenCount(0);

            if(atom.getFormalCharge() == null)
                atom.setFormalCharge(0);
        }

        for(IBond bond : molecule.bonds())
            if(!BondOrders.isDelocalized(bond))
                bond.setIsAromatic(false);

        for(IAtom atom : molecule.atoms())
            atom.setIsAromatic(false);

        configureElectrons(molecule);
        ConnectivityLabels.assign(molecule);
    }


    /**
     * Assigns radical electrons to atoms whose valence is lower than the standard valence of their element, and fills
     * the remaining valence electrons with lone pairs. Radicals that are already present are kept.
     *
     * @param molecule
     * @throws CDKException if an atom has an unsupported element or an odd or negative lone pair electron count
     */
    public static void configureElectrons(IAtomContainer molecule) throws CDKException
    {
        for(IAtom atom : molecule.atoms())
        {
            int index = molecule.indexOf(atom);
            int valenceElectrons;

            try
            {
                valenceElectrons = Electrons.getValenceElectrons(atom);
            }
            catch(IllegalArgumentException e)
            {
                throw new CDKException(e.getMessage(), e);
            }

            int charge = Electrons.getCharge(atom);
            int valence = Electrons.getValence(molecule, atom);

            if(Electrons.getRadicalCount(molecule, atom) == 0)
            {
                int radicals = getStandardValence(valenceElectrons, charge) - valence;

                for(int i = 0; i < radicals; i++)
                    Electrons.incrementRadical(molecule, atom);
            }

            int radicals = Electrons.getRadicalCount(molecule, atom);
            int remaining = valenceElectrons - charge - valence - radicals;

            if(remaining < 0 || remaining % 2 != 0)
                throw new CDKException("atom " + index + " (" + atom.getSymbol() + ") has " + remaining
                        + " electrons left for lone pairs");

            int missing = remaining / 2 - Electrons.getLonePairCount(molecule, atom);

            if(missing < 0)
                throw new CDKException("atom " + index + " (" + atom.getSymbol() + ") has too many lone pairs");

            for(int i = 0; i < missing; i++)
                Electrons.incrementLonePairs(molecule, atom);
        }
    }


    private static int getStandardValence(int valenceElectrons, int charge)
    {
        if(valenceElectrons < 4)
            return valenceElectrons - charge;
        else if(valenceElectrons == 4)
            return 4 - Math.abs(charge);
        else
            return 8 - valenceElectrons + charge;
    }
}
