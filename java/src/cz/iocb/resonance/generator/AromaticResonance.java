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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IBond.Order;
import cz.iocb.resonance.molecule.AromaticRing;
import cz.iocb.resonance.molecule.AtomTypeException;
import cz.iocb.resonance.molecule.AtomTypes;
import cz.iocb.resonance.molecule.BondOrders;
import cz.iocb.resonance.molecule.ConnectivityLabels;
import cz.iocb.resonance.molecule.Electrons;
import cz.iocb.resonance.molecule.Equivalence;
import cz.iocb.resonance.molecule.EquivalenceMode;
import cz.iocb.resonance.molecule.Kekulizer;
import cz.iocb.resonance.molecule.MoleculeFeatures;
import cz.iocb.resonance.molecule.Rings;



/**
 * Conversions between the aromatic (benzene bond) and Kekule forms of a molecule.
 */
public class AromaticResonance
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(AromaticResonance.class);


    private static class Candidate
    {
        final IAtomContainer molecule;
        final List<AromaticRing> rings;


        Candidate(IAtomContainer molecule, List<AromaticRing> rings)
        {
            this.molecule = molecule;
            this.rings = rings;
        }
    }


    /**
     * Generates the aromatic form of the molecule. For radicals whose radical can be shifted into a ring, the forms
     * with the most aromatic rings are generated. Usually a single structure is returned; forms with the same number
     * of aromatic rings give more of them. An empty list means that the molecule is not aromatic.
     *
     * @param molecule
     * @param features features of the molecule, or null to analyze it
     * @param generator generator used to saturate radical shifts
     * @return aromatic structures
     * @throws CDKException if ring perception fails
     * @throws CloneNotSupportedException
     */
    public static List<IAtomContainer> generateAromaticResonanceStructures(IAtomContainer molecule,
            MoleculeFeatures features, ResonanceGenerator generator) throws CDKException, CloneNotSupportedException
    {
        if(features == null)
            features = new MoleculeFeatures(molecule);

        List<IAtomContainer> result = new ArrayList<IAtomContainer>();

        if(!features.isCyclic)
            return result;

        IAtomContainer copy = molecule.clone();
        ConnectivityLabels.copy(molecule, copy);

        List<int[]> cycles = Rings.getAllSimpleCyclesOfSize(copy, Rings.AROMATIC_RING_SIZE);
        List<AromaticRing> aromaticRings = Rings.getAromaticRings(copy, cycles);

        List<Candidate> candidates = new ArrayList<Candidate>();

        if(features.isRadical && !features.isArylRadical && aromaticRings.size() < cycles.size())
        {
            /* the radical may be shifted to a position that gives more aromatic rings */
            List<IAtomContainer> kekuleList;

            if(Rings.isAromatic(copy))
                kekuleList = generateKekuleStructure(copy);
            else
                kekuleList = new ArrayList<IAtomContainer>(Collections.singletonList(copy));

            generator.saturate(kekuleList, Arrays.asList(ResonanceMethod.ADJACENT), EquivalenceMode.ISOMORPHIC, false);

            int maxNum = 0;

            for(IAtomContainer structure : kekuleList)
            {
                List<AromaticRing> rings = Rings.getAromaticRings(structure);

                if(rings.size() > maxNum)
                {
                    maxNum = rings.size();
                    candidates.clear();
                }

                if(rings.size() == maxNum)
                    candidates.add(new Candidate(structure, rings));
            }
        }
        else
        {
            candidates.add(new Candidate(copy, aromaticRings));
        }

        for(Candidate candidate : candidates)
        {
            if(candidate.rings.isEmpty())
                continue;

            if(!delocalizeRings(candidate.molecule, candidate.rings))
            {
                LOGGER.debug("no ring can be made aromatic, structure is not aromatic");
                continue;
            }

            boolean unique = true;

            for(IAtomContainer structure : result)
            {
                if(Equivalence.isIsomorphic(structure, candidate.molecule))
                {
                    unique = false;
                    break;
                }
            }

            if(unique)
                result.add(candidate.molecule);
        }

        return result;
    }


    /**
     * Converts the bonds of the rings to benzene bonds. If the fully aromatic structure is not valid, the rings are
     * converted one by one, and a ring that cannot be converted is tried again after the others.
     *
     * @param molecule molecule modified in place
     * @param rings aromatic rings of the molecule
     * @return false if no ring could be converted
     */
    static boolean delocalizeRings(IAtomContainer molecule, List<AromaticRing> rings)
    {
        List<Order[]> originalOrders = new ArrayList<Order[]>();

        for(AromaticRing ring : rings)
            originalOrders.add(delocalizeRing(molecule, ring));

        try
        {
            AtomTypes.validate(molecule);
            return true;
        }
        catch(AtomTypeException e)
        {
            LOGGER.debug("aromatic form is not valid, trying rings one by one: %s", e.getMessage());
        }

        for(int r = rings.size() - 1; r >= 0; r--)
            restoreRing(molecule, rings.get(r), originalOrders.get(r));


        List<AromaticRing> queue = new ArrayList<AromaticRing>(rings);
        int i = 0;
        int counter = 0;

        while(i < queue.size() && counter < 2 * queue.size())
        {
            counter++;

            AromaticRing ring = queue.get(i);
            Order[] original = delocalizeRing(molecule, ring);

            try
            {
                AtomTypes.validate(molecule);
                i++;
            }
            catch(AtomTypeException e)
            {
                /* the ring may depend on other rings, so it is retried after them */
                LOGGER.debug("%s cannot be made aromatic yet: %s", ring, e.getMessage());
                restoreRing(molecule, ring, original);
                queue.add(queue.remove(i));
            }
        }

        return i > 0;
    }


    /**
     * @return the previous orders of the ring bonds, null for benzene bonds
     */
    private static Order[] delocalizeRing(IAtomContainer molecule, AromaticRing ring)
    {
        IBond[] bonds = ring.getBonds(molecule);
        Order[] orders = new Order[bonds.length];

        for(int i = 0; i < bonds.length; i++)
        {
            orders[i] = BondOrders.isDelocalized(bonds[i]) ? null : bonds[i].getOrder();
            BondOrders.setDelocalized(bonds[i]);
        }

        return orders;
    }


    private static void restoreRing(IAtomContainer molecule, AromaticRing ring, Order[] orders)
    {
        IBond[] bonds = ring.getBonds(molecule);

        for(int i = 0; i < bonds.length; i++)
        {
            if(orders[i] == null)
                BondOrders.setDelocalized(bonds[i]);
            else
                BondOrders.setOrder(bonds[i], orders[i]);
        }
    }


    /**
     * Generates a Kekule form of a molecule with benzene bonds on carbon atoms. The arrangement of double bonds is
     * the one chosen by CDK.
     *
     * @param molecule
     * @return a single Kekule structure, or an empty list if there is nothing to kekulize or kekulization fails
     * @throws CloneNotSupportedException
     */
    public static List<IAtomContainer> generateKekuleStructure(IAtomContainer molecule)
            throws CloneNotSupportedException
    {
        List<IAtomContainer> result = new ArrayList<IAtomContainer>();

        if(!hasAromaticCarbon(molecule))
            return result;

        IAtomContainer kekule = molecule.clone();
        ConnectivityLabels.copy(molecule, kekule);

        try
        {
            Kekulizer.kekulize(kekule);
        }
        catch(CDKException e)
        {
            LOGGER.debug("kekulization failed: %s", e.getMessage());
            return result;
        }

        result.add(kekule);
        return result;
    }


    private static boolean hasAromaticCarbon(IAtomContainer molecule)
    {
        for(IAtom atom : molecule.atoms())
            if(Electrons.isCarbon(atom) && Electrons.getDelocalizedBondCount(molecule, atom) > 0)
                return true;

        return false;
    }


    /**
     * Generates the Kekule structure with the opposite arrangement of single and double bonds. Only molecules with a
     * single aromatic ring in a Kekule form are supported.
     *
     * @param molecule
     * @return the opposite Kekule structure, or an empty list
     * @throws CloneNotSupportedException
     */
    public static List<IAtomContainer> generateOppositeKekuleStructure(IAtomContainer molecule)
            throws CloneNotSupportedException
    {
        List<IAtomContainer> result = new ArrayList<IAtomContainer>();

        if(Rings.isAromatic(molecule))
            return result;

        IAtomContainer opposite = molecule.clone();
        ConnectivityLabels.copy(molecule, opposite);

        List<AromaticRing> rings = Rings.getAromaticRings(opposite);

        if(rings.size() != 1)
            return result;

        int singles = 0;
        int doubles = 0;

        for(IBond bond : rings.get(0).getBonds(opposite))
        {
            if(BondOrders.isSingle(bond))
            {
                singles++;
                BondOrders.setOrder(bond, Order.DOUBLE);
            }
            else if(BondOrders.isDouble(bond))
            {
                doubles++;
                BondOrders.setOrder(bond, Order.SINGLE);
            }
            else
            {
                return result;
            }
        }

        if(singles != 3 || doubles != 3)
            return result;

        try
        {
            AtomTypes.validate(opposite);
        }
        catch(AtomTypeException e)
        {
            LOGGER.debug("opposite Kekule structure is not valid: %s", e.getMessage());
            return result;
        }

        result.add(opposite);
        return result;
    }
}
